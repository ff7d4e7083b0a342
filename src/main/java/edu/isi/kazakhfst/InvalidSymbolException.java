package edu.isi.kazakhfst;
/** for input containing a token outside the cascade's input alphabet. 
    the offending text and its position in the word are kept for the caller */
public class InvalidSymbolException extends Exception {
	private final String symbol;
	private final int position;
	/**      Constructs a new exception for the token at the given position. */
	public InvalidSymbolException(String symbol, int position, String alphabetName) {
		super("Symbol '"+symbol+"' at position "+position+" is not in alphabet "+alphabetName);
		this.symbol = symbol;
		this.position = position;
	}
	public String getSymbol() { return symbol; }
	public int getPosition() { return position; }
}
