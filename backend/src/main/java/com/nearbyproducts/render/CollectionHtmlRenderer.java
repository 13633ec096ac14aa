package com.nearbyproducts.render;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.text.NumberFormat;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.util.HtmlUtils;

import com.nearbyproducts.model.Hit;

/**
 * Renders a static product grid for a city collection page.
 */
@Component
public class CollectionHtmlRenderer {

    static final String LAYOUT_SCRIPT = "static-templates/masonry-layout.js";

    private final String layoutScript;

    public CollectionHtmlRenderer() {
        try (InputStream in = new ClassPathResource(LAYOUT_SCRIPT).getInputStream()) {
            this.layoutScript = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + LAYOUT_SCRIPT, e);
        }
    }

    public String render(List<Hit> products, String cityName, long totalHits, Instant generated) {
        String city = escape(cityName);
        int count = products.size();

        StringBuilder html = new StringBuilder();
        html.append("<div class=\"geo-results-static\" data-generated=\"").append(generated)
            .append("\" data-city=\"").append(city).append("\">\n");
        html.append("  <div class=\"geo-results__inner\">\n");
        html.append("    <div class=\"geo-results__meta\">\n");
        html.append("      <p class=\"geo-results__count\">Showing ").append(count)
            .append(count == 1 ? " artwork" : " artworks")
            .append(" from ").append(city).append(" and nearby areas");
        if (totalHits > count) {
            html.append(" (").append(totalHits - count).append(" more available)");
        }
        html.append("</p>\n");
        html.append("    </div>\n");
        html.append("    <div class=\"geo-results__grid\">\n");
        html.append("      <div class=\"masonry-grid masonry-grid--static\">\n");
        for (Hit product : products) {
            appendCard(html, product);
        }
        html.append("      </div>\n");
        html.append("    </div>\n");
        html.append("  </div>\n");
        html.append("</div>\n");
        html.append(layoutScript);
        return html.toString();
    }

    private void appendCard(StringBuilder html, Hit product) {
        String title = escape(product.getTitle());
        String imageUrl = product.getImageUrl();
        String price = formatPrice(product.getPrice());

        html.append("        <div class=\"masonry-item\">\n");
        html.append("          <div class=\"card-wrapper product-card-wrapper\">\n");
        html.append("            <div class=\"card card--standard card--media\">\n");
        html.append("              <a href=\"/products/").append(escape(product.getHandle()))
            .append("\" class=\"full-unstyled-link\">\n");
        if (imageUrl != null) {
            html.append("                <div class=\"card__media\">\n");
            html.append("                  <img src=\"").append(escape(imageUrl)).append("\" alt=\"").append(title)
                .append("\" loading=\"lazy\" style=\"width: 100%; height: auto; max-height: 400px; object-fit: cover; display: block;\">\n");
            html.append("                </div>\n");
        }
        html.append("                <div class=\"card__content\">\n");
        html.append("                  <h3 class=\"card__heading\">").append(title).append("</h3>\n");
        if (price != null) {
            html.append("                  <div class=\"price\">").append(price).append("</div>\n");
        }
        html.append("                </div>\n");
        html.append("              </a>\n");
        html.append("            </div>\n");
        html.append("          </div>\n");
        html.append("        </div>\n");
    }

    static String formatPrice(BigDecimal price) {
        if (price == null || price.signum() == 0) {
            return null;
        }
        NumberFormat format = NumberFormat.getCurrencyInstance(Locale.GERMANY);
        return format.format(price);
    }

    private static String escape(String text) {
        return text == null ? "" : HtmlUtils.htmlEscape(text, StandardCharsets.UTF_8.name());
    }
}
