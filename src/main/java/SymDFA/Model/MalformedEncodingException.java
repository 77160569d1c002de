package SymDFA.Model;

/**
 * An integer handed to the decoder is not a valid canonical encoding.
 */
public class MalformedEncodingException extends SymbolicDFAException {
    public MalformedEncodingException(String message) {
        super(message);
    }
}
