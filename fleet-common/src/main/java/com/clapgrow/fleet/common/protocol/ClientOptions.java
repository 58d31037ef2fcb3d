package com.clapgrow.fleet.common.protocol;

/**
 * Options passed to the protocol client when a connection is created.
 * 
 * @param pairingCodeMode Link through a pairing code instead of resuming stored credentials
 * @param printQrInTerminal Render QR codes on stdout (always off for managed sessions)
 * @param browserName Browser identity announced to the network
 * @param syncFullHistory Request the full message history on link
 */
public record ClientOptions(
    boolean pairingCodeMode,
    boolean printQrInTerminal,
    String browserName,
    boolean syncFullHistory
) {

    public static final String DEFAULT_BROWSER = "macOS/Safari";

    /**
     * Options for a session that must be linked with a pairing code.
     */
    public static ClientOptions forNewPairing() {
        return new ClientOptions(true, false, DEFAULT_BROWSER, false);
    }

    /**
     * Options for a session resuming from stored credentials.
     */
    public static ClientOptions forRestore() {
        return new ClientOptions(false, false, DEFAULT_BROWSER, false);
    }
}
