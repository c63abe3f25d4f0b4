/**
 * Micrometer bridge for reconciler metrics.
 *
 * <p>Pass a {@link reconciler.micrometer.MicrometerMetricsExporter} to
 * {@link reconciler.Reconciler.Builder#metrics(reconciler.spi.MetricsExporter)}.
 */
package reconciler.micrometer;
