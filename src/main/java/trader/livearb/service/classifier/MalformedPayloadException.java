package trader.livearb.service.classifier;

/**
 * An inbound frame or payload that cannot be turned into a domain object.
 */
public class MalformedPayloadException extends RuntimeException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
