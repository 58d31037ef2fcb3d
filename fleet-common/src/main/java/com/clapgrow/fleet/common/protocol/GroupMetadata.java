package com.clapgrow.fleet.common.protocol;

import java.util.List;

/**
 * Group subject and membership as reported by the network.
 */
public record GroupMetadata(String id, String subject, List<Participant> participants) {

    public GroupMetadata {
        participants = participants == null ? List.of() : List.copyOf(participants);
    }

    /**
     * JIDs of participants holding any admin role.
     */
    public List<String> adminJids() {
        return participants.stream()
            .filter(Participant::isAdmin)
            .map(Participant::id)
            .toList();
    }

    /**
     * @param admin Admin role ("admin", "superadmin") or null for regular members
     */
    public record Participant(String id, String admin) {
        public boolean isAdmin() {
            return admin != null;
        }
    }
}
