package com.librenovel.ast;

import com.librenovel.ast.Node.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sealed interface for nodes of the embedded animation and transformation
 * language (ATL) attached to image, transform, show and scene statements.
 */
public sealed interface AtlNode {

    <T> T accept(AtlVisitor<T> visitor);

    SourceLocation location();

    /**
     * Sequence of ATL statements. Its location is the location of its first
     * statement, or {@link SourceLocation#EMPTY_BLOCK} when the colon that
     * opened it had nothing after it.
     */
    record Block(List<AtlNode> statements, SourceLocation loc) implements AtlNode {
        public Block {
            statements = List.copyOf(statements);
        }

        public static Block of(SourceLocation loc, AtlNode... statements) {
            return new Block(List.of(statements), loc);
        }

        @Override
        public <T> T accept(AtlVisitor<T> visitor) {
            return visitor.visitBlock(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * The general ATL statement: an optional warper or pause, then splines,
     * properties and displayable expressions, all on one line.
     */
    record Multipurpose(
        String warper,
        String warpFunction,
        String duration,
        String revolution,
        String circles,
        List<Spline> splines,
        List<Property> properties,
        List<Expression> expressions,
        SourceLocation loc
    ) implements AtlNode {

        public record Spline(String name, List<String> knots) {}

        public record Property(String key, String value) {}

        public record Expression(String expression, String withExpr) {}

        public Multipurpose {
            if (duration == null) {
                duration = "0";
            }
            if (circles == null) {
                circles = "0";
            }
            splines = splines != null ? List.copyOf(splines) : List.of();
            properties = properties != null ? List.copyOf(properties) : List.of();
            expressions = expressions != null ? List.copyOf(expressions) : List.of();
        }

        @Override
        public <T> T accept(AtlVisitor<T> visitor) {
            return visitor.visitMultipurpose(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }

        /**
         * Builder for multipurpose statements.
         */
        public static class Builder {
            private final ArrayList<Spline> splines = new ArrayList<>();
            private final ArrayList<Property> properties = new ArrayList<>();
            private final ArrayList<Expression> expressions = new ArrayList<>();
            private String warper;
            private String warpFunction;
            private String duration = "0";
            private String revolution;
            private String circles = "0";

            public Builder warper(String warper, String duration) {
                this.warper = warper;
                this.duration = duration;
                return this;
            }

            public Builder warpFunction(String warpFunction, String duration) {
                this.warpFunction = warpFunction;
                this.duration = duration;
                return this;
            }

            public Builder duration(String duration) {
                this.duration = duration;
                return this;
            }

            public Builder revolution(String revolution) {
                this.revolution = revolution;
                return this;
            }

            public Builder circles(String circles) {
                this.circles = circles;
                return this;
            }

            public Builder spline(String name, String... knots) {
                splines.add(new Spline(name, List.of(knots)));
                return this;
            }

            public Builder property(String key, String value) {
                properties.add(new Property(key, value));
                return this;
            }

            public Builder expression(String expression, String withExpr) {
                expressions.add(new Expression(expression, withExpr));
                return this;
            }

            public Multipurpose build(SourceLocation loc) {
                return new Multipurpose(warper, warpFunction, duration, revolution, circles,
                    splines, properties, expressions, loc);
            }
        }
    }

    /**
     * One "contains:" block per child.
     */
    record Child(List<Block> children, SourceLocation loc) implements AtlNode {
        @Override
        public <T> T accept(AtlVisitor<T> visitor) {
            return visitor.visitChild(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * Consecutive "choice" blocks, each with its weight expression.
     */
    record Choice(List<WeightedBlock> choices, SourceLocation loc) implements AtlNode {
        public static final String DEFAULT_CHANCE = "1.0";

        public record WeightedBlock(String chance, Block block) {}

        @Override
        public <T> T accept(AtlVisitor<T> visitor) {
            return visitor.visitChoice(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    record ContainsExpr(String expression, SourceLocation loc) implements AtlNode {
        @Override
        public <T> T accept(AtlVisitor<T> visitor) {
            return visitor.visitContainsExpr(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    record Event(String name, SourceLocation loc) implements AtlNode {
        @Override
        public <T> T accept(AtlVisitor<T> visitor) {
            return visitor.visitEvent(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    record Function(String expr, SourceLocation loc) implements AtlNode {
        @Override
        public <T> T accept(AtlVisitor<T> visitor) {
            return visitor.visitFunction(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * Event handlers keyed by event name, in the order the reader stored them.
     */
    record On(Map<String, Block> handlers, SourceLocation loc) implements AtlNode {
        public On {
            handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
        }

        @Override
        public <T> T accept(AtlVisitor<T> visitor) {
            return visitor.visitOn(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    /**
     * One "parallel:" block per branch.
     */
    record Parallel(List<Block> blocks, SourceLocation loc) implements AtlNode {
        @Override
        public <T> T accept(AtlVisitor<T> visitor) {
            return visitor.visitParallel(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    record Repeat(String repeats, SourceLocation loc) implements AtlNode {
        @Override
        public <T> T accept(AtlVisitor<T> visitor) {
            return visitor.visitRepeat(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    record Time(String time, SourceLocation loc) implements AtlNode {
        @Override
        public <T> T accept(AtlVisitor<T> visitor) {
            return visitor.visitTime(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }

    record Unknown(String tag, Map<String, Object> payload, SourceLocation loc) implements AtlNode {
        @Override
        public <T> T accept(AtlVisitor<T> visitor) {
            return visitor.visitUnknown(this);
        }

        @Override
        public SourceLocation location() {
            return loc;
        }
    }
}
