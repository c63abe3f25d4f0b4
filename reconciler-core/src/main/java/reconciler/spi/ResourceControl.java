package reconciler.spi;

import reconciler.model.ResourceInfo;
import reconciler.model.ResourceStatus;

import java.util.List;

/**
 * Control API for the compute resources whose deletion is being scheduled
 * (containers, VMs, ...). Resource ids are the string form of an integer id.
 *
 * <p>Implementations throw {@link reconciler.TransientCollaboratorException} for
 * network errors and timeouts and {@link reconciler.NotFoundException} when the
 * resource does not exist.
 */
public interface ResourceControl {

  boolean exists(String resourceId);

  /**
   * @return the resource's status, {@link ResourceStatus#UNKNOWN} if it cannot be told
   */
  ResourceStatus status(String resourceId);

  /**
   * Irreversibly deletes the resource.
   *
   * @throws reconciler.NotFoundException if the resource is already gone
   */
  void delete(String resourceId);

  List<ResourceInfo> list();

  void start(String resourceId);

  void stop(String resourceId);
}
