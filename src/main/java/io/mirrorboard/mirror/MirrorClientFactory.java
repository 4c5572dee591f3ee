package io.mirrorboard.mirror;

import io.mirrorboard.config.RepositoryConfig;

@FunctionalInterface
public interface MirrorClientFactory {
    MirrorClient create(RepositoryConfig config);
}
