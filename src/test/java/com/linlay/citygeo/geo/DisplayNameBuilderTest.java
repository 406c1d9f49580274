package com.linlay.citygeo.geo;

import com.linlay.citygeo.provider.NominatimAddress;
import com.linlay.citygeo.provider.NominatimPlace;
import org.junit.jupiter.api.Test;

import static com.linlay.citygeo.provider.NominatimFixtures.address;
import static com.linlay.citygeo.provider.NominatimFixtures.emptyAddress;
import static com.linlay.citygeo.provider.NominatimFixtures.place;
import static org.assertj.core.api.Assertions.assertThat;

class DisplayNameBuilderTest {

    @Test
    void shouldDropRegionEqualToSettlement() {
        NominatimPlace beijing = place(1, "北京", "北京", "中国");

        assertThat(DisplayNameBuilder.buildDisplayName(beijing)).isEqualTo("北京, 中国");
    }

    @Test
    void shouldKeepSettlementEqualToCountry() {
        NominatimPlace singapore = place(2, "Singapore", null, "Singapore");

        assertThat(DisplayNameBuilder.buildDisplayName(singapore)).isEqualTo("Singapore, Singapore");
    }

    @Test
    void shouldComposeAllThreeLevelsThroughVariantSelection() {
        NominatimPlace london = place(3, "大倫敦;大伦敦", "英格兰;英格蘭", "英国");

        assertThat(DisplayNameBuilder.buildDisplayName(london)).isEqualTo("大伦敦, 英格兰, 英国");
    }

    @Test
    void shouldCompareRegionAfterVariantSelection() {
        NominatimPlace tokyo = place(4, "东京都/東京都", "東京都;东京都", "日本");

        assertThat(DisplayNameBuilder.buildDisplayName(tokyo)).isEqualTo("东京都, 日本");
    }

    @Test
    void shouldFallBackThroughSettlementFieldsInOrder() {
        NominatimAddress townOnly = new NominatimAddress(null, "Hallstatt", "Lahn", "Gmunden", "Oberösterreich", null, "Österreich", "at");
        NominatimAddress villageOnly = new NominatimAddress(null, "", "Giethoorn", "Steenwijkerland", "Overijssel", null, "Nederland", "nl");
        NominatimAddress countyOnly = new NominatimAddress(null, null, null, "Inyo County", "California", null, "United States", "us");

        assertThat(DisplayNameBuilder.buildDisplayName(place(5, "1", "2", null, townOnly)))
                .isEqualTo("Hallstatt, Oberösterreich, Österreich");
        assertThat(DisplayNameBuilder.buildDisplayName(place(6, "1", "2", "", villageOnly)))
                .isEqualTo("Giethoorn, Overijssel, Nederland");
        assertThat(DisplayNameBuilder.buildDisplayName(place(7, "1", "2", null, countyOnly)))
                .isEqualTo("Inyo County, California, United States");
    }

    @Test
    void shouldPreferNameOverCity() {
        NominatimPlace place = place(8, "31.2", "121.4", "Pudong", address("Shanghai", "Shanghai", null, "China"));

        assertThat(DisplayNameBuilder.buildDisplayName(place)).isEqualTo("Pudong, Shanghai, China");
    }

    @Test
    void shouldUseProvinceWhenStateIsMissing() {
        NominatimPlace place = place(9, "52.1", "5.1", "Utrecht", address(null, null, "Utrecht;Utrecht", "Nederland"));

        assertThat(DisplayNameBuilder.buildDisplayName(place)).isEqualTo("Utrecht, Nederland");
    }

    @Test
    void shouldFallBackToRawDisplayNameWhenNoPartsSurvive() {
        NominatimPlace raw = new NominatimPlace(10, "0", "0", "", "Null Island, Atlantic Ocean",
                "place", "islet", 0.1, "islet", emptyAddress());
        NominatimPlace noAddress = new NominatimPlace(11, "0", "0", null, "Somewhere",
                "place", "islet", 0.1, "islet", null);
        NominatimPlace nothing = new NominatimPlace(12, "0", "0", null, null,
                "place", "islet", 0.1, "islet", null);

        assertThat(DisplayNameBuilder.buildDisplayName(raw)).isEqualTo("Null Island, Atlantic Ocean");
        assertThat(DisplayNameBuilder.buildDisplayName(noAddress)).isEqualTo("Somewhere");
        assertThat(DisplayNameBuilder.buildDisplayName(nothing)).isEmpty();
    }
}
