/**
 * REST controllers and HTTP error mapping.
 */
package com.phillippitts.affectsignal.presentation;
