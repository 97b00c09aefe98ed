/**
 * Session-scoped storage of resolved question expressions.
 */
package com.phillippitts.affectsignal.service.store;
