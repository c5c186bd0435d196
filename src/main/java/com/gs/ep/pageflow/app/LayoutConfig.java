package com.gs.ep.pageflow.app;

import com.gs.ep.pageflow.layout.paginator.PageGeometry;
import com.gs.ep.pageflow.model.PageMargins;
import com.gs.ep.pageflow.model.measure.PdfFontMeasurer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Utility to load page geometry and measurer settings from pageflow.properties.
 * Sizes are in CSS pixels (96 per inch); the defaults describe a US Letter page with 1in margins.
 */
public class LayoutConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(LayoutConfig.class);
    private static final String DEFAULT_CONFIG = "pageflow.properties";

    private final Properties properties = new Properties();

    public LayoutConfig() {
        this(DEFAULT_CONFIG);
    }

    public LayoutConfig(String configPath) {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(configPath)) {
            if (input == null) {
                LOGGER.warn("Unable to find {} on the classpath. Using defaults.", configPath);
                return;
            }
            properties.load(input);
        } catch (IOException ex) {
            throw new LayoutConfigException("Failed to read " + configPath, ex);
        }
    }

    public LayoutConfig(Properties properties) {
        this.properties.putAll(properties);
    }

    public double getPageWidth() {
        return getDouble("page.width", 816);
    }

    public double getPageHeight() {
        return getDouble("page.height", 1056);
    }

    public PageMargins getMargins() {
        return new PageMargins(
                getDouble("page.margin.top", 96),
                getDouble("page.margin.right", 96),
                getDouble("page.margin.bottom", 96),
                getDouble("page.margin.left", 96));
    }

    public int getColumnCount() {
        return getInt("columns.count", 1);
    }

    public double getColumnGap() {
        return getDouble("columns.gap", 48);
    }

    public double getFontSize() {
        return getDouble("measurer.font.size", PdfFontMeasurer.DEFAULT_FONT_SIZE);
    }

    public double getLineHeightMultiplier() {
        return getDouble("measurer.line.height", PdfFontMeasurer.DEFAULT_LINE_HEIGHT_MULTIPLIER);
    }

    public double getTabWidth() {
        return getDouble("measurer.tab.width", PdfFontMeasurer.DEFAULT_TAB_WIDTH);
    }

    public PageGeometry toPageGeometry() {
        return new PageGeometry(getPageWidth(), getPageHeight(), getMargins(), getColumnCount(), getColumnGap());
    }

    public PdfFontMeasurer createMeasurer() {
        return new PdfFontMeasurer(getFontSize(), getLineHeightMultiplier(), getTabWidth());
    }

    private double getDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            throw new LayoutConfigException("Invalid number for " + key + ": '" + value + "'", ex);
        }
    }

    private int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new LayoutConfigException("Invalid integer for " + key + ": '" + value + "'", ex);
        }
    }
}
