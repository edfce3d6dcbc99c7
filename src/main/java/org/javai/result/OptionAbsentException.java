package org.javai.result;

/**
 * Thrown when {@link Option#unwrap()} is called on {@link Option#none()}.
 */
public class OptionAbsentException extends UnwrapException {

    static final String ABSENT = "Option is None";

    public OptionAbsentException() {
        super("Cannot unwrap an absent value", ABSENT);
    }
}
