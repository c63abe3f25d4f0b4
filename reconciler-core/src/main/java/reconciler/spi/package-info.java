/**
 * Service Provider Interfaces the reconciler consumes.
 *
 * <p>Integrators implement these to plug in the remote event store, the resource
 * control API, the chat notifier and a metrics backend. All calls are treated as
 * blocking network operations and are run under a per-call timeout.
 *
 * @see reconciler.spi.EventStore
 * @see reconciler.spi.ResourceControl
 * @see reconciler.spi.Notifier
 * @see reconciler.spi.MetricsExporter
 */
package reconciler.spi;
