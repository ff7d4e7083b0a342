package edu.isi.kazakhfst;
/** for well-formed input that no path through the cascade accepts */
public class NoValidTransductionException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public NoValidTransductionException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public NoValidTransductionException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public NoValidTransductionException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public NoValidTransductionException(Throwable cause) { super(cause); }
}
