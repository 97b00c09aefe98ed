/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.affectsignal.config.ThreadPoolConfig} - submission executor and
 *       polling scheduler</li>
 *   <li>{@link com.phillippitts.affectsignal.config.ThreadPoolMetricsConfig} - Micrometer gauges
 *       for the submission executor</li>
 *   <li>{@link com.phillippitts.affectsignal.config.InferenceConfig} - HTTP client and job client
 *       for the remote inference service</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code @ConfigurationProperties} holders
 *       ({@code affect.inference.*}, {@code affect.normalizer.*}, {@code threadpool.*})</li>
 *   <li>{@code config.logging} - MDC request filter</li>
 * </ul>
 *
 * @see com.phillippitts.affectsignal.config.properties
 */
package com.phillippitts.affectsignal.config;
