package com.clapgrow.fleet.common.jid;

import java.util.regex.Pattern;

/**
 * JID (address) helpers for the messaging network.
 * 
 * A JID has the shape {@code user[:device]@server}. Device-qualified JIDs
 * identify one linked device; the normalized form drops the device suffix.
 */
public final class Jids {

    public static final String USER_SERVER = "s.whatsapp.net";
    public static final String GROUP_SUFFIX = "@g.us";
    public static final String STATUS_BROADCAST = "status@broadcast";
    public static final String NEWSLETTER_SUFFIX = "@newsletter";

    private static final Pattern DEVICE_QUALIFIED = Pattern.compile(":\\d+@");

    private Jids() {
        // Utility class - prevent instantiation
    }

    /**
     * Decode a device-qualified JID to {@code user@server}; anything else is returned unchanged.
     * 
     * @param jid JID to decode (may be null)
     * @return Decoded JID, or the input if it is not device-qualified
     */
    public static String decode(String jid) {
        if (jid == null || !DEVICE_QUALIFIED.matcher(jid).find()) {
            return jid;
        }
        int at = jid.indexOf('@');
        String user = jid.substring(0, at);
        String server = jid.substring(at + 1);
        int colon = user.indexOf(':');
        if (colon > 0) {
            user = user.substring(0, colon);
        }
        if (user.isEmpty() || server.isEmpty()) {
            return jid;
        }
        return user + "@" + server;
    }

    /**
     * Normalize a user JID: drop the device suffix and map legacy servers to the user server.
     */
    public static String normalizeUser(String jid) {
        if (jid == null || jid.isEmpty()) {
            return jid;
        }
        String user = userPart(jid);
        int at = jid.indexOf('@');
        String server = at >= 0 ? jid.substring(at + 1) : USER_SERVER;
        if ("c.us".equals(server)) {
            server = USER_SERVER;
        }
        return user + "@" + server;
    }

    /**
     * User part of a JID without device suffix ("2547:12@s.whatsapp.net" becomes "2547").
     */
    public static String userPart(String jid) {
        if (jid == null) {
            return "";
        }
        int at = jid.indexOf('@');
        String user = at >= 0 ? jid.substring(0, at) : jid;
        int colon = user.indexOf(':');
        return colon >= 0 ? user.substring(0, colon) : user;
    }

    public static boolean isGroup(String jid) {
        return jid != null && jid.endsWith(GROUP_SUFFIX);
    }

    public static boolean isStatusBroadcast(String jid) {
        return STATUS_BROADCAST.equals(jid);
    }

    public static boolean isNewsletter(String jid) {
        return jid != null && jid.endsWith(NEWSLETTER_SUFFIX);
    }

    public static String userJid(String number) {
        return number + "@" + USER_SERVER;
    }
}
