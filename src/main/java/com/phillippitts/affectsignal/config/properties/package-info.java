/**
 * Typed configuration bound from {@code application.properties}, validated at startup.
 */
package com.phillippitts.affectsignal.config.properties;
