package com.familygraph.service;

import com.familygraph.model.FamilyTree;
import com.familygraph.model.Marriage;
import com.familygraph.model.ParentChild;
import com.familygraph.model.Person;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Draws a tree at the positions stored on its persons. Positions are the
 * top-left corners of the person boxes.
 */
@Service
public class SvgGenerator {

    static final int NODE_WIDTH = 140;
    static final int NODE_HEIGHT = 50;
    private static final int PADDING = 40;
    private static final int MIN_WIDTH = 400;

    public String generateSvg(FamilyTree tree) {
        if (tree.isEmpty()) {
            return emptyTreeSvg();
        }

        double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
        for (Person p : tree.persons().values()) {
            minX = Math.min(minX, p.x());
            minY = Math.min(minY, p.y());
            maxX = Math.max(maxX, p.x() + NODE_WIDTH);
            maxY = Math.max(maxY, p.y() + NODE_HEIGHT);
        }

        // Shift everything so the top-left box sits at (PADDING, PADDING)
        double offsetX = PADDING - minX;
        double offsetY = PADDING - minY;
        int svgWidth = (int) Math.max(Math.ceil(maxX - minX) + PADDING * 2, MIN_WIDTH);
        int svgHeight = (int) Math.ceil(maxY - minY) + PADDING * 2;

        StringBuilder svg = new StringBuilder();
        svg.append(String.format("""
            <?xml version="1.0" encoding="UTF-8"?>
            <svg xmlns="http://www.w3.org/2000/svg" width="%d" height="%d" viewBox="0 0 %d %d">
              <defs>
                <style>
                  .person-box { fill: #f8f9fa; stroke: #495057; stroke-width: 1.5; rx: 6; }
                  .person-box.male { fill: #e7f1fb; }
                  .person-box.female { fill: #fbe9ef; }
                  .person-name { font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif; font-size: 12px; fill: #212529; text-anchor: middle; font-weight: 500; }
                  .person-dates { font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif; font-size: 10px; fill: #6c757d; text-anchor: middle; }
                  .connector { stroke: #adb5bd; stroke-width: 1.5; fill: none; }
                  .marriage { stroke: #c0392b; stroke-width: 2; fill: none; }
                </style>
              </defs>
              <rect width="100%%" height="100%%" fill="#ffffff"/>
            """, svgWidth, svgHeight, svgWidth, svgHeight));

        // Connectors first so boxes are drawn over them
        svg.append("  <!-- Marriages -->\n");
        for (Marriage marriage : tree.marriages().values()) {
            Person a = tree.persons().get(marriage.spouse1Id());
            Person b = tree.persons().get(marriage.spouse2Id());
            if (a == null || b == null) continue;

            Person left = a.x() <= b.x() ? a : b;
            Person right = left == a ? b : a;
            svg.append(String.format(Locale.ROOT,
                "  <path class=\"marriage\" d=\"M %.1f %.1f L %.1f %.1f\"/>\n",
                left.x() + offsetX + NODE_WIDTH, left.y() + offsetY + NODE_HEIGHT / 2.0,
                right.x() + offsetX, right.y() + offsetY + NODE_HEIGHT / 2.0));
        }

        svg.append("  <!-- Connectors -->\n");
        Set<String> drawn = new HashSet<>();
        for (ParentChild relation : tree.parentChild()) {
            Person child = tree.persons().get(relation.childId());
            if (child == null) continue;

            double px;
            double py;
            String key;
            Marriage marriage = relation.marriageId() != null ? tree.marriages().get(relation.marriageId()) : null;
            Person spouse1 = marriage != null ? tree.persons().get(marriage.spouse1Id()) : null;
            Person spouse2 = marriage != null ? tree.persons().get(marriage.spouse2Id()) : null;
            if (spouse1 != null && spouse2 != null) {
                // From the middle of the marriage line
                px = (spouse1.x() + spouse2.x()) / 2 + NODE_WIDTH / 2.0;
                py = (spouse1.y() + spouse2.y()) / 2 + NODE_HEIGHT / 2.0;
                key = marriage.id() + ">" + child.id();
            } else {
                Person parent = tree.persons().get(relation.parentId());
                if (parent == null) continue;
                px = parent.x() + NODE_WIDTH / 2.0;
                py = parent.y() + NODE_HEIGHT;
                key = parent.id() + ">" + child.id();
            }
            if (!drawn.add(key)) continue;

            px += offsetX;
            py += offsetY;
            double cx = child.x() + offsetX + NODE_WIDTH / 2.0;
            double cy = child.y() + offsetY;
            double midY = py + (cy - py) / 2;

            svg.append(String.format(Locale.ROOT,
                "  <path class=\"connector\" d=\"M %.1f %.1f L %.1f %.1f L %.1f %.1f L %.1f %.1f\"/>\n",
                px, py, px, midY, cx, midY, cx, cy));
        }

        svg.append("  <!-- People -->\n");
        for (Person person : tree.persons().values()) {
            double x = person.x() + offsetX;
            double y = person.y() + offsetY;

            svg.append(String.format(Locale.ROOT, "  <g data-person-id=\"%s\">\n", escapeXml(person.id())));
            svg.append(String.format(Locale.ROOT,
                "    <rect class=\"person-box %s\" x=\"%.1f\" y=\"%.1f\" width=\"%d\" height=\"%d\"/>\n",
                genderClass(person), x, y, NODE_WIDTH, NODE_HEIGHT));

            // Name (truncate if too long)
            String name = person.displayName();
            if (name.length() > 18) {
                name = name.substring(0, 16) + "...";
            }
            svg.append(String.format(Locale.ROOT, "    <text class=\"person-name\" x=\"%.1f\" y=\"%.1f\">%s</text>\n",
                x + NODE_WIDTH / 2.0, y + 22, escapeXml(name)));

            String dates = person.lifespan();
            if (!dates.isEmpty()) {
                svg.append(String.format(Locale.ROOT, "    <text class=\"person-dates\" x=\"%.1f\" y=\"%.1f\">%s</text>\n",
                    x + NODE_WIDTH / 2.0, y + 38, escapeXml(dates)));
            }

            svg.append("  </g>\n");
        }

        svg.append("</svg>");
        return svg.toString();
    }

    private String genderClass(Person person) {
        return switch (person.gender().toLowerCase(Locale.ROOT)) {
            case "male", "m" -> "male";
            case "female", "f" -> "female";
            default -> "unknown";
        };
    }

    private String escapeXml(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&apos;");
    }

    private String emptyTreeSvg() {
        return """
            <?xml version="1.0" encoding="UTF-8"?>
            <svg xmlns="http://www.w3.org/2000/svg" width="400" height="200" viewBox="0 0 400 200">
              <rect width="100%" height="100%" fill="#f8f9fa"/>
              <text x="200" y="100" text-anchor="middle" font-family="sans-serif" fill="#6c757d">
                No family members found
              </text>
            </svg>
            """;
    }
}
