package com.example.onetwoone.model;

/** Who may cut the current segment short. */
public enum SkipPolicy {

    /** Both members, in every segment. */
    ANY_MEMBER {
        @Override
        public boolean allows(int segment, Role role) {
            return role != null;
        }
    },

    /** Only the segment authority (user1). */
    AUTHORITY_ONLY {
        @Override
        public boolean allows(int segment, Role role) {
            return role != null && role.isAuthority();
        }
    },

    /** Only the member holding the floor, so the right alternates with the speaking table. */
    SPEAKER_ONLY {
        @Override
        public boolean allows(int segment, Role role) {
            return SegmentTable.canSpeak(segment, role);
        }
    };

    public abstract boolean allows(int segment, Role role);
}
