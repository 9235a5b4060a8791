package org.netpreserve.sitemirror.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.util.Url;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One discovered page. Nodes refer to their parent and children by ID only; the {@link PageGraph}
 * owns the nodes themselves.
 */
public class PageNode {
    private final String id;
    private final Url url;
    private final int depth;
    private final @Nullable String parentId;
    private final List<String> childIds;
    private @Nullable String title;
    private @Nullable String linkText;
    private @Nullable String probeError;
    private @Nullable List<String> pathSegments;

    PageNode(String id, Url url, int depth, @Nullable String parentId, @Nullable String linkText) {
        this(id, url, depth, parentId, new ArrayList<>(), null, linkText, null, null);
    }

    @JsonCreator
    PageNode(@JsonProperty("id") String id,
             @JsonProperty("url") Url url,
             @JsonProperty("depth") int depth,
             @JsonProperty("parentId") @Nullable String parentId,
             @JsonProperty("childIds") @Nullable List<String> childIds,
             @JsonProperty("title") @Nullable String title,
             @JsonProperty("linkText") @Nullable String linkText,
             @JsonProperty("probeError") @Nullable String probeError,
             @JsonProperty("pathSegments") @Nullable List<String> pathSegments) {
        this.id = Objects.requireNonNull(id, "id");
        this.url = Objects.requireNonNull(url, "url");
        if (depth < 0) throw new IllegalArgumentException("negative depth");
        if ((parentId == null) != (depth == 0)) {
            throw new IllegalArgumentException("only the root (depth 0) may lack a parent: " + id);
        }
        this.depth = depth;
        this.parentId = parentId;
        this.childIds = childIds == null ? new ArrayList<>() : new ArrayList<>(childIds);
        this.title = title;
        this.linkText = linkText;
        this.probeError = probeError;
        this.pathSegments = pathSegments == null ? null : List.copyOf(pathSegments);
    }

    @JsonProperty
    public String id() {
        return id;
    }

    @JsonProperty
    public Url url() {
        return url;
    }

    @JsonProperty
    public int depth() {
        return depth;
    }

    @JsonProperty
    public @Nullable String parentId() {
        return parentId;
    }

    @JsonProperty
    public List<String> childIds() {
        return Collections.unmodifiableList(childIds);
    }

    void addChild(String childId) {
        childIds.add(childId);
    }

    @JsonIgnore
    public boolean isRoot() {
        return parentId == null;
    }

    @JsonProperty
    public @Nullable String title() {
        return title;
    }

    public void setTitle(@Nullable String title) {
        this.title = title;
    }

    /**
     * Anchor text of the link that introduced this page.
     */
    @JsonProperty
    public @Nullable String linkText() {
        return linkText;
    }

    @JsonProperty
    public @Nullable String probeError() {
        return probeError;
    }

    public void setProbeError(@Nullable String probeError) {
        this.probeError = probeError;
    }

    /**
     * Sanitized title chain from the root (exclusive) to this node (inclusive). The root's segments
     * are empty.
     *
     * @throws IllegalStateException if segments haven't been assigned yet
     */
    public List<String> pathSegments() {
        if (pathSegments == null) throw new IllegalStateException("Path segments not yet assigned for " + id);
        return pathSegments;
    }

    @JsonProperty("pathSegments")
    private @Nullable List<String> pathSegmentsOrNull() {
        return pathSegments;
    }

    public boolean hasPathSegments() {
        return pathSegments != null;
    }

    void assignPathSegments(List<String> segments) {
        if (pathSegments != null) throw new IllegalStateException("Path segments already assigned for " + id);
        if (segments.size() != depth) {
            throw new IllegalArgumentException("Expected " + depth + " segments for " + id + " but got " + segments);
        }
        this.pathSegments = List.copyOf(segments);
    }

    /**
     * The best available human-readable title: probed title, then link text, then URL slug.
     */
    public String displayTitle() {
        if (title != null && !title.isBlank()) return title.strip();
        if (linkText != null && !linkText.isBlank()) return linkText.strip();
        String slug = PageIds.slug(url);
        return slug == null ? "Untitled" : slug;
    }

    @Override
    public String toString() {
        return "PageNode{" + id + " depth=" + depth + " " + url + "}";
    }
}
