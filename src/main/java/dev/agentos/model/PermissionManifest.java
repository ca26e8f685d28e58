package dev.agentos.model;

import java.util.List;

/**
 * Path globs an agent may touch, relative to the project root.
 * Deny globs take precedence over every allow list.
 */
public record PermissionManifest(
    List<String> allowRead,
    List<String> allowWrite,
    List<String> allowExecute,
    List<String> deny
) {
    public PermissionManifest {
        allowRead = allowRead == null ? List.of() : List.copyOf(allowRead);
        allowWrite = allowWrite == null ? List.of() : List.copyOf(allowWrite);
        allowExecute = allowExecute == null ? List.of() : List.copyOf(allowExecute);
        deny = deny == null ? List.of() : List.copyOf(deny);
    }

    public static PermissionManifest empty() {
        return new PermissionManifest(List.of(), List.of(), List.of(), List.of());
    }

    public static PermissionManifest readWrite(List<String> allowRead, List<String> allowWrite) {
        return new PermissionManifest(allowRead, allowWrite, List.of(), List.of());
    }
}
