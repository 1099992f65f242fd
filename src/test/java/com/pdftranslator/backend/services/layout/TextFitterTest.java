package com.pdftranslator.backend.services.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.Test;

import com.pdftranslator.backend.config.TranslatorProperties;

class TextFitterTest {

    private final TranslatorProperties properties = new TranslatorProperties();
    private final TextFitter fitter = new TextFitter(properties);
    private final ResolvedFont helvetica = new ResolvedFont(PDType1Font.HELVETICA, false);

    @Test
    void fit_shortText_keepsPreferredSize() {
        FittedText fitted = fitter.fit("Annual report", helvetica, 200f, 20f, 11f);

        assertThat(fitted.lines()).containsExactly("Annual report");
        assertThat(fitted.fontSize()).isEqualTo(11f);
        assertThat(fitted.clipped()).isFalse();
        assertThat(fitted.leading()).isEqualTo(11f * properties.getLayout().getLineSpacing());
    }

    @Test
    void fit_longerTranslation_shrinksUntilItFitsTheBox() {
        String text = "The board approved the budget for the next fiscal year after a long discussion of costs and revenue.";

        FittedText fitted = fitter.fit(text, helvetica, 200f, 30f, 11f);

        assertThat(fitted.clipped()).isFalse();
        assertThat(fitted.fontSize()).isLessThan(11f).isGreaterThanOrEqualTo(properties.getLayout().getMinFontSize());
        assertThat(TextFitter.heightOf(fitted.lines().size(), fitted.fontSize(), properties.getLayout().getLineSpacing()))
                .isLessThanOrEqualTo(30.5f);
        for (String line : fitted.lines()) {
            assertThat(helvetica.width(line, fitted.fontSize())).isLessThanOrEqualTo(200f);
        }
    }

    @Test
    void fit_textThatCannotFit_isClippedAtMinimumSizeWithEllipsis() {
        String text = "overflowing sentence ".repeat(100);

        FittedText fitted = fitter.fit(text, helvetica, 100f, 20f, 11f);

        assertThat(fitted.clipped()).isTrue();
        assertThat(fitted.fontSize()).isEqualTo(properties.getLayout().getMinFontSize());
        assertThat(fitted.lines().get(fitted.lines().size() - 1)).endsWith(TextFitter.CLIP_INDICATOR);
        assertThat(TextFitter.heightOf(fitted.lines().size(), fitted.fontSize(), properties.getLayout().getLineSpacing()))
                .isLessThanOrEqualTo(20.5f);
    }

    @Test
    void fit_foldsLettersTheStandardFontCannotShow() {
        FittedText fitted = fitter.fit("Başarılı işlem, güncel döküman", helvetica, 400f, 20f, 11f);

        assertThat(String.join(" ", fitted.lines())).isEqualTo("Basarili islem, güncel döküman");
    }

    @Test
    void wrap_keepsExplicitLineBreaks_andSplitsWordsWiderThanTheBox() {
        assertThat(fitter.wrap("First line\nSecond line", helvetica, 10f, 300f))
                .containsExactly("First line", "Second line");

        assertThat(fitter.wrap("Donaudampfschifffahrtsgesellschaft", helvetica, 10f, 40f))
                .hasSizeGreaterThan(1)
                .allSatisfy(line -> assertThat(helvetica.width(line, 10f)).isLessThanOrEqualTo(40f));
    }

    @Test
    void heightOf_firstLineOneEmThenOneLeadingPerLine() {
        assertThat(TextFitter.heightOf(0, 10f, 1.2f)).isZero();
        assertThat(TextFitter.heightOf(1, 10f, 1.2f)).isEqualTo(10f);
        assertThat(TextFitter.heightOf(3, 10f, 1.2f)).isCloseTo(34f, within(0.001f));
    }
}
