package org.netpreserve.sitemirror.path;

public enum ResolverType {
    INTRA,
    INTER,
    EXTERNAL,
    FILESYSTEM
}
