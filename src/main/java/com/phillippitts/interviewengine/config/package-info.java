/**
 * Application configuration beans and properties.
 *
 * <p>Configuration classes:
 * <ul>
 *   <li>{@link com.phillippitts.interviewengine.config.ThreadPoolConfig} - capability and event
 *       executors with MDC propagation</li>
 *   <li>{@link com.phillippitts.interviewengine.config.ThreadPoolMetricsConfig} - capability pool
 *       gauges</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.capability} - default capability beans and HTTP clients</li>
 *   <li>{@code config.credential} - relay credential issuer and secret resolution</li>
 *   <li>{@code config.orchestration} - engine, pipeline and registry wiring</li>
 *   <li>{@code config.logging} - MDC servlet filter</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.interviewengine.config;
