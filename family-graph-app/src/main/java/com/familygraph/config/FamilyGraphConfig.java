package com.familygraph.config;

import com.familygraph.layout.LayoutDirection;
import com.familygraph.layout.LayoutOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Application settings bound from application.yml under 'familygraph'.
 */
@Configuration
@ConfigurationProperties(prefix = "familygraph")
public class FamilyGraphConfig {

    private Layout layout = new Layout();
    private History history = new History();
    private Data data = new Data();

    public Layout getLayout() { return layout; }
    public void setLayout(Layout layout) { this.layout = layout; }

    public History getHistory() { return history; }
    public void setHistory(History history) { this.history = history; }

    public Data getData() { return data; }
    public void setData(Data data) { this.data = data; }

    /**
     * Defaults for layout requests that leave a field unset.
     */
    public static class Layout {
        private LayoutDirection direction = LayoutDirection.TOP_DOWN;
        private double spacingX = LayoutOptions.DEFAULT_SPACING_X;
        private double spacingY = LayoutOptions.DEFAULT_SPACING_Y;

        public LayoutDirection getDirection() { return direction; }
        public void setDirection(LayoutDirection direction) { this.direction = direction; }

        public double getSpacingX() { return spacingX; }
        public void setSpacingX(double spacingX) { this.spacingX = spacingX; }

        public double getSpacingY() { return spacingY; }
        public void setSpacingY(double spacingY) { this.spacingY = spacingY; }
    }

    public static class History {
        private int maxSize = 50;

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
    }

    public static class Data {
        private String dir = "data";

        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }
    }
}
