package reconciler.model;

import java.util.Objects;

/**
 * One entry of {@link reconciler.spi.ResourceControl#list()}.
 */
public record ResourceInfo(String resourceId, String name, ResourceStatus status) {

  public ResourceInfo {
    Objects.requireNonNull(resourceId, "resourceId");
    name = name == null ? "" : name;
    status = status == null ? ResourceStatus.UNKNOWN : status;
  }
}
