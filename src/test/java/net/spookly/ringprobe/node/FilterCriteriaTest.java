package net.spookly.ringprobe.node;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import net.spookly.ringprobe.channel.ChannelStatus;
import org.junit.jupiter.api.Test;

class FilterCriteriaTest {
    private final VantagePoint amsterdam = new VantagePoint("example01.ring.nlnog.net", "example01.ring.nlnog.net",
            1103, "Amsterdam", "NL", "Europe", "SURF", ChannelStatus.HEALTHY);

    @Test
    void emptyCriteriaMatchEverything() {
        assertTrue(FilterCriteria.none().matches(amsterdam));
        assertTrue(FilterCriteria.builder().accept(FilterField.CITY, " ", null).build().isEmpty());
    }

    @Test
    void fieldsCombineWithAnd() {
        FilterCriteria matching = FilterCriteria.builder()
                .accept(FilterField.COUNTRY_CODE, "nl", "de")
                .accept(FilterField.ASN, "1103")
                .build();
        FilterCriteria wrongCity = FilterCriteria.builder()
                .accept(FilterField.COUNTRY_CODE, "NL")
                .accept(FilterField.CITY, "Rotterdam")
                .build();

        assertTrue(matching.matches(amsterdam));
        assertFalse(wrongCity.matches(amsterdam));
        assertEquals(List.of(FilterField.COUNTRY_CODE), matching.multiValueFields());
    }

    @Test
    void nodeFieldMatchesShortName() {
        FilterCriteria byNode = FilterCriteria.builder().accept(FilterField.NODE, "EXAMPLE01").build();

        assertTrue(byNode.matches(amsterdam));
        assertEquals(FilterField.NODE, FilterField.fromParam("node"));
        assertEquals(FilterField.COUNTRY_CODE, FilterField.fromParam("CountryCode"));
    }

    @Test
    void missingAttributeNeverMatches() {
        VantagePoint bare = new VantagePoint("bare01", "bare01", null, null, null, null, null, ChannelStatus.HEALTHY);

        assertFalse(FilterCriteria.builder().accept(FilterField.ASN, "1103").build().matches(bare));
    }
}
