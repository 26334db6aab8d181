package net.spookly.ringprobe.directory;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ContinentLookupTest {
    private final ContinentLookup lookup = ContinentLookup.fromClasspath();

    @Test
    void mapsCountryCodesToContinents() {
        assertEquals("Europe", lookup.continentFor("NL"));
        assertEquals("Europe", lookup.continentFor("no"));
        assertEquals("North America", lookup.continentFor("US"));
        assertEquals("Oceania", lookup.continentFor("NZ"));
        assertEquals("Asia", lookup.continentFor("JP"));
    }

    @Test
    void unknownCodesFallBack() {
        assertEquals(ContinentLookup.UNKNOWN, lookup.continentFor("ZZ"));
        assertEquals(ContinentLookup.UNKNOWN, lookup.continentFor(null));
    }

    @Test
    void resolvesCountryNames() {
        assertEquals("Netherlands", ContinentLookup.countryName("nl"));
        assertEquals("QQ", ContinentLookup.countryName("QQ"));
    }
}
