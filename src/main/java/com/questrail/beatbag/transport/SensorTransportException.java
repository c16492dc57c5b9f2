package com.questrail.beatbag.transport;

/**
 * Failure reported by a {@link SensorTransport} for a discovery, write or
 * descriptor operation, or for the link itself.
 *
 * <p>Transports pass instances to their listener rather than throwing them; the
 * device session attaches them to the configuration error it reports.</p>
 */
public class SensorTransportException extends Exception
{
    private final int status;

    public SensorTransportException(String message)
    {
        this(message, -1, null);
    }

    public SensorTransportException(String message, Throwable cause)
    {
        this(message, -1, cause);
    }

    /**
     * @param status transport-specific status code (e.g. a GATT status), or -1
     */
    public SensorTransportException(String message, int status, Throwable cause)
    {
        super(message, cause);
        this.status = status;
    }

    /**
     * Transport-specific status code, or -1 when the transport has none.
     */
    public int status()
    {
        return status;
    }
}
