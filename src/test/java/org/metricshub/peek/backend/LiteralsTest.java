package org.metricshub.peek.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.math.BigInteger;
import org.junit.Test;
import org.metricshub.peek.PeekException;

public class LiteralsTest {

	@Test
	public void testQuotesAreRemoved() {
		assertEquals("hello", Literals.unescape("\"hello\""));
		assertEquals("hello", Literals.unescape("'hello'"));
		assertEquals("", Literals.unescape("''"));
		assertEquals("it's \"here\"", Literals.unescape("'''it's \"here\"'''"));
		assertEquals("a\nb", Literals.unescape("\"\"\"a\nb\"\"\""));
	}

	@Test
	public void testEscapes() {
		assertEquals("a\tb\nc\\d'e\"f", Literals.unescape("'a\\tb\\nc\\\\d\\'e\\\"f'"));
		assertEquals("\007\b\f\013\r", Literals.unescape("'\\a\\b\\f\\v\\r'"));
		assertEquals("joined", Literals.unescape("'''join\\\ned'''"));
	}

	@Test
	public void testNumericEscapes() {
		assertEquals("A", Literals.unescape("'\\101'"));
		assertEquals("\0" + "9", Literals.unescape("'\\09'"));
		assertEquals("A", Literals.unescape("'\\x41'"));
		assertEquals("é", Literals.unescape("'\\u00e9'"));
		assertEquals(new String(Character.toChars(0x1F600)), Literals.unescape("'\\U0001F600'"));
	}

	@Test
	public void testUnknownEscapesAreKept() {
		assertEquals("\\q", Literals.unescape("'\\q'"));
		assertEquals("\\xZZ", Literals.unescape("'\\xZZ'"));
		assertEquals("\\u12", Literals.unescape("'\\u12'"));
	}

	@Test
	public void testNumbers() {
		assertEquals(Long.valueOf(42), Literals.parseNumber("42"));
		assertEquals(Long.valueOf(-42), Literals.parseNumber("-42"));
		assertEquals(Long.valueOf(42), Literals.parseNumber("+42"));
		assertEquals(Double.valueOf(4.2), Literals.parseNumber("4.2"));
		assertEquals(Double.valueOf(0.42), Literals.parseNumber(".42"));
		assertEquals(Double.valueOf(-0.42), Literals.parseNumber("-.42"));
		assertEquals(Double.valueOf(420), Literals.parseNumber("42e+1"));
		assertEquals(Double.valueOf(0.42), Literals.parseNumber("4.2e-1"));
		assertEquals(new BigInteger("99999999999999999999"), Literals.parseNumber("99999999999999999999"));
		assertThrows(PeekException.class, () -> Literals.parseNumber("4x"));
	}
}
