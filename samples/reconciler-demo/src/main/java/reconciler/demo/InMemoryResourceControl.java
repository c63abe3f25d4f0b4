package reconciler.demo;

import reconciler.NotFoundException;
import reconciler.model.ResourceInfo;
import reconciler.model.ResourceStatus;
import reconciler.spi.ResourceControl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hypervisor stand-in holding a fixed set of virtual machines.
 */
final class InMemoryResourceControl implements ResourceControl {
  private final Map<String, ResourceInfo> resources = new LinkedHashMap<>();

  InMemoryResourceControl add(String resourceId, String name, ResourceStatus status) {
    resources.put(resourceId, new ResourceInfo(resourceId, name, status));
    return this;
  }

  @Override
  public synchronized boolean exists(String resourceId) {
    return resources.containsKey(resourceId);
  }

  @Override
  public synchronized ResourceStatus status(String resourceId) {
    return find(resourceId).status();
  }

  @Override
  public synchronized void delete(String resourceId) {
    find(resourceId);
    resources.remove(resourceId);
  }

  @Override
  public synchronized List<ResourceInfo> list() {
    return new ArrayList<>(resources.values());
  }

  @Override
  public synchronized void start(String resourceId) {
    ResourceInfo info = find(resourceId);
    resources.put(resourceId, new ResourceInfo(resourceId, info.name(), ResourceStatus.RUNNING));
  }

  @Override
  public synchronized void stop(String resourceId) {
    ResourceInfo info = find(resourceId);
    resources.put(resourceId, new ResourceInfo(resourceId, info.name(), ResourceStatus.STOPPED));
  }

  private ResourceInfo find(String resourceId) {
    ResourceInfo info = resources.get(resourceId);
    if (info == null) {
      throw new NotFoundException("resource " + resourceId);
    }
    return info;
  }
}
