package trader.livearb.service.command;

public class CommandSerializationException extends RuntimeException {

    public CommandSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
