package com.civilworks.carbon.service.enrichment;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SpendParserTest {

    @Test
    public void currencySymbolsAndSeparatorsAreIgnored() {
        assertEquals(4999.5, SpendParser.parse("£4,999.50"));
        assertEquals(12000.0, SpendParser.parse("GBP 12 000"));
        assertEquals(250000.0, SpendParser.parse("250000"));
    }

    @Test
    public void unparsableTextIsZero() {
        assertEquals(0.0, SpendParser.parse(null));
        assertEquals(0.0, SpendParser.parse(""));
        assertEquals(0.0, SpendParser.parse("n/a"));
        assertEquals(0.0, SpendParser.parse("1.2.3"));
    }

    @Test
    public void overflowingDigitRunIsZero() {
        assertEquals(0.0, SpendParser.parse("9".repeat(400)));
    }

    @Test
    public void signIsDropped() {
        assertEquals(500.0, SpendParser.parse("-500"));
    }
}
