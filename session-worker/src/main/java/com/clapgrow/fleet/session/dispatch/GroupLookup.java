package com.clapgrow.fleet.session.dispatch;

import com.clapgrow.fleet.common.protocol.GroupMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Result of the best-effort group metadata fetch. A failed lookup leaves the
 * group context empty; it never fails the event.
 */
public record GroupLookup(GroupMetadata metadata, String failure) {

    private static final GroupLookup NOT_A_GROUP = new GroupLookup(null, null);

    public static GroupLookup found(GroupMetadata metadata) {
        return new GroupLookup(metadata, null);
    }

    public static GroupLookup failed(String reason) {
        return new GroupLookup(null, reason);
    }

    public static GroupLookup notAGroup() {
        return NOT_A_GROUP;
    }

    public boolean isPresent() {
        return metadata != null;
    }

    public boolean isFailed() {
        return failure != null;
    }

    public Optional<GroupMetadata> group() {
        return Optional.ofNullable(metadata);
    }

    public Optional<String> subject() {
        return group().map(GroupMetadata::subject);
    }

    public List<String> admins() {
        return metadata == null ? List.of() : metadata.adminJids();
    }
}
