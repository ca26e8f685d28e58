package dev.agentos.sandbox;

import dev.agentos.model.PermissionManifest;
import dev.agentos.model.SideEffect;

import java.util.List;

public enum Operation {
    READ,
    WRITE,
    EXECUTE;

    List<String> allowGlobs(PermissionManifest manifest) {
        return switch (this) {
            case READ -> manifest.allowRead();
            case WRITE -> manifest.allowWrite();
            case EXECUTE -> manifest.allowExecute();
        };
    }

    public SideEffect.Access access() {
        return switch (this) {
            case READ -> SideEffect.Access.READ;
            case WRITE -> SideEffect.Access.WRITE;
            case EXECUTE -> SideEffect.Access.EXECUTE;
        };
    }
}
