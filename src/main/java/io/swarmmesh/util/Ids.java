package io.swarmmesh.util;

import java.util.UUID;

public final class Ids {
    private Ids() {
    }

    public static String session() {
        return "ses_" + UUID.randomUUID();
    }

    public static String proposal() {
        return "prp_" + UUID.randomUUID();
    }

    public static String healingAction() {
        return "heal_" + UUID.randomUUID();
    }
}
