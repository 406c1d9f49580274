package com.linlay.citygeo.geo;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ChineseQueryTranslatorTest {

    @Test
    void shouldTranslateKnownCities() {
        assertThat(ChineseQueryTranslator.translate("北京")).isEqualTo("beijing");
        assertThat(ChineseQueryTranslator.translate("乌鲁木齐")).isEqualTo("urumqi");
        assertThat(ChineseQueryTranslator.translate("吉林")).isEqualTo("jilin city");
        assertThat(ChineseQueryTranslator.translate("新北")).isEqualTo("new taipei city");
        assertThat(ChineseQueryTranslator.translate("吉隆坡")).isEqualTo("kuala lumpur");
    }

    @Test
    void shouldReturnUnknownQueriesUnchanged() {
        assertThat(ChineseQueryTranslator.translate("未知城市XYZ")).isEqualTo("未知城市XYZ");
        assertThat(ChineseQueryTranslator.translate("北京市")).isEqualTo("北京市");
        assertThat(ChineseQueryTranslator.translate("beijing")).isEqualTo("beijing");
        assertThat(ChineseQueryTranslator.translate("")).isEmpty();
    }

    @Test
    void shouldDetectHanCharacters() {
        assertThat(ChineseQueryTranslator.containsHan("東京")).isTrue();
        assertThat(ChineseQueryTranslator.containsHan("Osaka 大阪")).isTrue();
        assertThat(ChineseQueryTranslator.containsHan("Tokyo")).isFalse();
        assertThat(ChineseQueryTranslator.containsHan("とうきょう")).isFalse();
        assertThat(ChineseQueryTranslator.containsHan(null)).isFalse();
    }

    @Test
    void languageShouldNormalizeToAcceptLanguageTag() {
        assertThat(GeoLanguage.from("zh").acceptLanguage()).isEqualTo("zh-CN,zh");
        assertThat(GeoLanguage.from(" ZH-tw ").acceptLanguage()).isEqualTo("zh-CN,zh");
        assertThat(GeoLanguage.from("en").acceptLanguage()).isEqualTo("en");
        assertThat(GeoLanguage.from("fr").acceptLanguage()).isEqualTo("en");
        assertThat(GeoLanguage.from(null).acceptLanguage()).isEqualTo("en");
    }
}
