/**
 * Spring Boot auto-configuration for the deletion reconciler.
 *
 * <p>Declare {@link reconciler.spi.EventStore}, {@link reconciler.spi.ResourceControl} and
 * {@link reconciler.spi.Notifier} beans; the reconciler and its
 * {@link reconciler.command.CommandHandler} are created and started from
 * {@code reconciler.*} properties.
 */
package reconciler.spring.boot;
