package com.librenovel.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Image specification shared by show, scene and hide.
 *
 * @param nameParts image name components, ignored when expression is set
 * @param expression displayable expression of "show expression ..."
 * @param alias tag given with "as"
 * @param atList transforms given with "at"
 * @param layer target layer, "master" unless "onlayer" was used
 * @param zorder zorder expression
 * @param behind tags given with "behind"
 */
public record ImageSpec(
    List<String> nameParts,
    String expression,
    String alias,
    List<String> atList,
    String layer,
    String zorder,
    List<String> behind
) {

    public static final String DEFAULT_LAYER = "master";

    public ImageSpec {
        nameParts = nameParts != null ? List.copyOf(nameParts) : List.of();
        atList = atList != null ? List.copyOf(atList) : List.of();
        behind = behind != null ? List.copyOf(behind) : List.of();
        if (layer == null) {
            layer = DEFAULT_LAYER;
        }
    }

    public static ImageSpec named(String... nameParts) {
        return new ImageSpec(List.of(nameParts), null, null, List.of(), DEFAULT_LAYER, null, List.of());
    }

    /**
     * Builder for image specs with several optional clauses.
     */
    public static class Builder {
        private final List<String> nameParts = new ArrayList<>();
        private final List<String> atList = new ArrayList<>();
        private final List<String> behind = new ArrayList<>();
        private String expression;
        private String alias;
        private String layer = DEFAULT_LAYER;
        private String zorder;

        public Builder name(String... parts) {
            nameParts.addAll(List.of(parts));
            return this;
        }

        public Builder expression(String expression) {
            this.expression = expression;
            return this;
        }

        public Builder alias(String alias) {
            this.alias = alias;
            return this;
        }

        public Builder at(String transform) {
            atList.add(transform);
            return this;
        }

        public Builder layer(String layer) {
            this.layer = layer;
            return this;
        }

        public Builder zorder(String zorder) {
            this.zorder = zorder;
            return this;
        }

        public Builder behind(String tag) {
            behind.add(tag);
            return this;
        }

        public ImageSpec build() {
            return new ImageSpec(nameParts, expression, alias, atList, layer, zorder, behind);
        }
    }
}
