package frontend.lexer;

import exception.SyntaxException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenListTest {

    @Test
    void consumeStopsAtEof() throws Exception {
        TokenList tokenList = new Lexer("a").lex();
        assertTrue(tokenList.hasNext());
        assertEquals("a", tokenList.consume().getContent());
        assertFalse(tokenList.hasNext());
        assertTrue(tokenList.consume().isOf(TokenType.EOF));
        assertTrue(tokenList.get().isOf(TokenType.EOF));
        assertTrue(tokenList.ahead(5).isOf(TokenType.EOF));
    }

    @Test
    void consumeExpectedReportsOffendingToken() throws Exception {
        TokenList tokenList = new Lexer("int 5").lex();
        tokenList.consumeExpected("expected 'int'", TokenType.INT);
        SyntaxException e = assertThrows(SyntaxException.class,
                () -> tokenList.consumeExpected("expected identifier after 'int'", TokenType.IDENT));
        assertEquals("SyntaxError at 1:5 near '5': expected identifier after 'int'", e.diagnostic());
    }
}
