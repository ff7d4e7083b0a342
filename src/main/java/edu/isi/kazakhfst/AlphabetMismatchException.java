package edu.isi.kazakhfst;
/** for combining patterns or automata whose symbol sets don't agree, or naming a symbol the alphabet doesn't have */
public class AlphabetMismatchException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public AlphabetMismatchException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public AlphabetMismatchException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public AlphabetMismatchException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public AlphabetMismatchException(Throwable cause) { super(cause); }
}
