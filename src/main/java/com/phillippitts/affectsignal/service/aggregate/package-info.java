/**
 * Round and session statistics, performance tiers and per-question assessments.
 */
package com.phillippitts.affectsignal.service.aggregate;
