package com.questrail.beatbag.protocol.wt901.model;

/**
 * Wt901Command
 * -----------------------------------------------------------------------------
 * Fixed 5-byte register commands written to the sensor during session
 * configuration.
 *
 * <p>All commands share the {@code FF AA} prefix followed by a register and a
 * little-endian 16-bit value. The byte sequences are fixed and must match the
 * device firmware exactly.</p>
 */
public enum Wt901Command
{
    /** Unlock register writes ({@code FF AA 69 88 B5}). */
    UNLOCK(0x69, 0x88, 0xB5),

    /** Set the output rate to 100 Hz ({@code FF AA 03 09 00}). */
    SET_RATE_100HZ(0x03, 0x09, 0x00),

    /** Persist the current configuration ({@code FF AA 00 00 00}). */
    SAVE_CONFIG(0x00, 0x00, 0x00);

    private static final int PREFIX_0 = 0xFF;
    private static final int PREFIX_1 = 0xAA;

    private final byte register;
    private final byte valueLow;
    private final byte valueHigh;

    Wt901Command(int register, int valueLow, int valueHigh)
    {
        this.register = (byte) register;
        this.valueLow = (byte) valueLow;
        this.valueHigh = (byte) valueHigh;
    }

    /**
     * Returns a fresh copy of the wire bytes for this command.
     */
    public byte[] bytes()
    {
        return new byte[] {
                (byte) PREFIX_0,
                (byte) PREFIX_1,
                register,
                valueLow,
                valueHigh
        };
    }
}
