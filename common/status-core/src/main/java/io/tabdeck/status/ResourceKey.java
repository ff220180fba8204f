package io.tabdeck.status;

/**
 * Identifies one managed workload. Used both as the channel lookup key and as the restart
 * deduplication key.
 */
public record ResourceKey(String namespace, String name) {

  public ResourceKey {
    namespace = requireNonBlank(namespace, "namespace");
    name = requireNonBlank(name, "name");
  }

  public static ResourceKey of(String namespace, String name) {
    return new ResourceKey(namespace, name);
  }

  @Override
  public String toString() {
    return namespace + "/" + name;
  }

  private static String requireNonBlank(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
    return value.trim();
  }
}
