package me.golemcore.knowledge.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.knowledge.domain.model.Complexity;
import me.golemcore.knowledge.domain.model.KnowledgeNode;
import me.golemcore.knowledge.domain.model.NodeMetadata;
import me.golemcore.knowledge.domain.model.NodeType;
import me.golemcore.knowledge.domain.model.SearchFilter;

import java.util.Collection;
import java.util.List;

/**
 * Evaluates search filters against a node. Node fields are resolved first,
 * then metadata fields. Enum values compare by their code, numbers compare
 * numerically, everything else by string form. A filter on an unknown field
 * never matches.
 */
final class SearchFilterMatcher {

    private SearchFilterMatcher() {
    }

    static boolean matchesAll(KnowledgeNode node, List<SearchFilter> filters) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        for (SearchFilter filter : filters) {
            if (filter != null && !matches(node, filter)) {
                return false;
            }
        }
        return true;
    }

    static boolean matches(KnowledgeNode node, SearchFilter filter) {
        if (filter.field() == null || filter.operator() == null) {
            return true;
        }
        Object actual = normalize(resolve(node, filter.field()));
        if (actual == null) {
            return false;
        }
        Object expected = filter.value();

        return switch (filter.operator()) {
        case EQ -> valueEquals(actual, normalize(expected));
        case NEQ -> !valueEquals(actual, normalize(expected));
        case GT -> compare(actual, normalize(expected)) > 0;
        case LT -> compare(actual, normalize(expected)) < 0;
        case CONTAINS -> expected != null && actual.toString().contains(normalize(expected).toString());
        case IN -> expected instanceof Collection<?> options
                && options.stream().anyMatch(option -> valueEquals(actual, normalize(option)));
        };
    }

    private static Object resolve(KnowledgeNode node, String field) {
        return switch (field) {
        case "id" -> node.getId();
        case "type" -> node.getType();
        case "name" -> node.getName();
        case "content" -> node.getContent();
        case "confidence" -> node.getConfidence();
        case "accessCount" -> node.getAccessCount();
        default -> resolveMetadata(node.getMetadata(), field);
        };
    }

    private static Object resolveMetadata(NodeMetadata metadata, String field) {
        if (metadata == null) {
            return null;
        }
        return switch (field) {
        case "complexity" -> metadata.getComplexity();
        case "quality" -> metadata.getQuality();
        case "relevance" -> metadata.getRelevance();
        default -> null;
        };
    }

    private static Object normalize(Object value) {
        if (value instanceof NodeType type) {
            return type.getCode();
        }
        if (value instanceof Complexity complexity) {
            return complexity.getCode();
        }
        return value;
    }

    private static boolean valueEquals(Object actual, Object expected) {
        if (expected == null) {
            return false;
        }
        if (actual instanceof Number left && expected instanceof Number right) {
            return Double.compare(left.doubleValue(), right.doubleValue()) == 0;
        }
        return actual.toString().equals(expected.toString());
    }

    /**
     * Numeric comparison. Non-numeric operands are incomparable and yield 0,
     * which fails both {@code gt} and {@code lt}.
     */
    private static int compare(Object actual, Object expected) {
        if (actual instanceof Number left && expected instanceof Number right) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        return 0;
    }
}
