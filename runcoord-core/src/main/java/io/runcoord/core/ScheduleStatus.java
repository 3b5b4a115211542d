package io.runcoord.core;

/**
 * Runtime status of a schedule row.
 *
 * <p>{@code SUCCEEDED} and {@code FAILED} describe the last finished occurrence; together with
 * {@code IDLE} they are claimable. {@code CLAIMED} and {@code EXECUTING} mean a live claim exists.
 */
public enum ScheduleStatus {
    IDLE {
        @Override
        public boolean isClaimable() {
            return true;
        }
    },
    CLAIMED {
        @Override
        public boolean isClaimable() {
            return false;
        }
    },
    EXECUTING {
        @Override
        public boolean isClaimable() {
            return false;
        }
    },
    SUCCEEDED {
        @Override
        public boolean isClaimable() {
            return true;
        }
    },
    FAILED {
        @Override
        public boolean isClaimable() {
            return true;
        }
    };

    public abstract boolean isClaimable();

    public boolean isLiveClaim() {
        return this == CLAIMED || this == EXECUTING;
    }
}
