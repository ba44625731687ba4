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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.domain.model.Entity;
import me.golemcore.knowledge.domain.model.EntityType;
import me.golemcore.knowledge.domain.model.ExtractionResult;
import me.golemcore.knowledge.domain.model.Relationship;
import me.golemcore.knowledge.domain.model.RelationshipType;
import me.golemcore.knowledge.domain.model.TextPosition;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts typed entities and relationships from text, primarily source code.
 *
 * <p>
 * Extraction runs independent lexical passes over the input:
 * <ul>
 * <li>{@code function name(...)} declarations</li>
 * <li>{@code const|let|var} declarations, classified as functions when the
 * value is a function or arrow expression, otherwise as variables</li>
 * <li>method declarations at the start of a line</li>
 * <li>class and interface declarations with their {@code extends} and
 * {@code implements} clauses</li>
 * <li>module imports in both {@code import x from 'mod'} and
 * {@code import a.b.C;} form</li>
 * </ul>
 *
 * <p>
 * Parents that are never declared in the text get a placeholder entity marked
 * {@code source=inferred}. Same-typed entities whose embeddings are more
 * similar than the configured threshold are linked with a bidirectional
 * {@code similar_to} relationship.
 *
 * <p>
 * Extraction never throws: unparseable input yields an empty result with
 * confidence 0.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class EntityExtractor {

    static final double EXTENDS_CONFIDENCE = 0.95;
    static final double IMPLEMENTS_CONFIDENCE = 0.9;
    private static final double MAX_CONFIDENCE = 0.95;
    private static final String ATTR_KIND = "kind";
    private static final String ATTR_MODULE_TYPE = "type";
    private static final String CONTEXT_PREFIX = "context.";

    private static final String IDENT = "[A-Za-z_$][\\w$]*";
    private static final String TYPE_REF = "[A-Za-z_$][\\w$.]*(?:\\s*<[^>{]*>)?";
    private static final String TYPE_LIST = TYPE_REF + "(?:\\s*,\\s*" + TYPE_REF + ")*";

    private static final Pattern FUNCTION_PATTERN = Pattern.compile(
            "\\bfunction\\s*\\*?\\s+(" + IDENT + ")\\s*\\(");
    private static final Pattern DECLARATION_PATTERN = Pattern.compile(
            "\\b(?:const|let|var)\\s+(" + IDENT + ")\\s*(?::[^=;\\n]+)?=(?![=>])\\s*");
    private static final Pattern FUNCTION_VALUE_PATTERN = Pattern.compile(
            "(?:async\\b|function\\b|\\([^)]*\\)\\s*(?::[^=]+)?=>|" + IDENT + "\\s*=>)");
    private static final Pattern METHOD_PATTERN = Pattern.compile(
            "^[ \\t]*(?:(?:public|private|protected|static|final|abstract|synchronized|async|override|default)\\s+)*"
                    + "(?:(" + "[A-Za-z_$][\\w$.]*(?:<[^>(]*>)?(?:\\[\\])*" + ")\\s+)?(" + IDENT + ")\\s*"
                    + "\\([^)]*\\)\\s*(?::\\s*[^{;]+)?(?:throws\\s+[\\w$.,\\s]+)?\\{",
            Pattern.MULTILINE);
    private static final Pattern CLASS_PATTERN = Pattern.compile(
            "\\b(class|interface)\\s+(" + IDENT + ")(?:\\s*<[^>{]*>)?"
                    + "(?:\\s+extends\\s+(" + TYPE_LIST + "))?"
                    + "(?:\\s+implements\\s+(" + TYPE_LIST + "))?");
    private static final Pattern ES_IMPORT_PATTERN = Pattern.compile(
            "\\bimport\\s+(?:type\\s+)?(?:\\{[^}]*\\}|\\*\\s+as\\s+" + IDENT + "|" + IDENT + ")"
                    + "(?:\\s*,\\s*(?:\\{[^}]*\\}|" + IDENT + "))?\\s+from\\s+['\"]([^'\"]+)['\"]");
    private static final Pattern QUALIFIED_IMPORT_PATTERN = Pattern.compile(
            "^[ \\t]*import\\s+(?:static\\s+)?([A-Za-z_$][\\w$]*(?:\\.[\\w$]+)+(?:\\.\\*)?)\\s*;",
            Pattern.MULTILINE);

    private static final Set<String> NON_METHOD_WORDS = Set.of(
            "if", "for", "while", "switch", "catch", "synchronized", "return", "new", "else", "function",
            "do", "try", "throw", "typeof", "await", "super", "this", "class", "interface", "import");

    private final EmbeddingService embeddingService;
    private final double similarityThreshold;

    public EntityExtractor(EmbeddingService embeddingService, KnowledgeProperties properties) {
        this.embeddingService = embeddingService;
        this.similarityThreshold = properties.getGraph().getSimilarityThreshold();
    }

    public ExtractionResult extract(String text) {
        return extract(text, Map.of());
    }

    /**
     * Extract entities and relationships from text.
     *
     * @param text
     *            source text, may be {@code null}
     * @param context
     *            optional caller context copied into every entity's attributes
     * @return extraction result, empty when nothing matched
     */
    public ExtractionResult extract(String text, Map<String, Object> context) {
        if (text == null || text.isBlank()) {
            return ExtractionResult.empty();
        }

        try {
            List<Entity> entities = new ArrayList<>();
            List<Relationship> relationships = new ArrayList<>();

            extractFunctions(text, entities);
            extractDeclarations(text, entities);
            extractMethods(text, entities);
            extractClasses(text, entities, relationships);
            extractImports(text, entities);

            if (entities.isEmpty()) {
                return ExtractionResult.empty();
            }

            applyContext(entities, context);
            computeEmbeddings(entities);
            linkSimilarEntities(entities, relationships);

            double confidence = calculateConfidence(entities, relationships);
            log.debug("[Extractor] Extracted {} entities, {} relationships (confidence={})",
                    entities.size(), relationships.size(), String.format("%.2f", confidence));
            return new ExtractionResult(entities, relationships, confidence);
        } catch (RuntimeException e) {
            log.warn("[Extractor] Extraction failed for text of {} chars: {}", text.length(), e.getMessage(), e);
            return ExtractionResult.empty();
        }
    }

    private void extractFunctions(String text, List<Entity> entities) {
        Matcher matcher = FUNCTION_PATTERN.matcher(text);
        while (matcher.find()) {
            entities.add(newEntity(matcher.group(1), EntityType.FUNCTION, matcher, Entity.SOURCE_PATTERN));
        }
    }

    private void extractDeclarations(String text, List<Entity> entities) {
        Matcher matcher = DECLARATION_PATTERN.matcher(text);
        while (matcher.find()) {
            Matcher value = FUNCTION_VALUE_PATTERN.matcher(text);
            value.region(matcher.end(), text.length());
            EntityType type = value.lookingAt() ? EntityType.FUNCTION : EntityType.VARIABLE;
            entities.add(newEntity(matcher.group(1), type, matcher, Entity.SOURCE_PATTERN));
        }
    }

    private void extractMethods(String text, List<Entity> entities) {
        Matcher matcher = METHOD_PATTERN.matcher(text);
        while (matcher.find()) {
            String returnType = matcher.group(1);
            String name = matcher.group(2);
            if (NON_METHOD_WORDS.contains(name) || (returnType != null && NON_METHOD_WORDS.contains(returnType))) {
                continue;
            }
            Entity entity = newEntity(name, EntityType.FUNCTION, matcher, Entity.SOURCE_PATTERN);
            entity.getAttributes().put(ATTR_KIND, "method");
            entities.add(entity);
        }
    }

    private void extractClasses(String text, List<Entity> entities, List<Relationship> relationships) {
        List<ClassMatch> matches = new ArrayList<>();
        Map<String, Entity> declared = new LinkedHashMap<>();

        Matcher matcher = CLASS_PATTERN.matcher(text);
        while (matcher.find()) {
            Entity entity = newEntity(matcher.group(2), EntityType.CLASS, matcher, Entity.SOURCE_PATTERN);
            entity.getAttributes().put(ATTR_KIND, matcher.group(1));
            entities.add(entity);
            declared.putIfAbsent(entity.getText(), entity);
            matches.add(new ClassMatch(entity, splitTypeList(matcher.group(3)), splitTypeList(matcher.group(4))));
        }

        Map<String, Entity> placeholders = new LinkedHashMap<>();
        for (ClassMatch match : matches) {
            for (String parent : match.parents()) {
                Entity target = resolveParent(parent, declared, placeholders);
                relationships.add(newRelationship(match.entity(), target, RelationshipType.EXTENDS,
                        EXTENDS_CONFIDENCE));
            }
            for (String contract : match.contracts()) {
                Entity target = resolveParent(contract, declared, placeholders);
                relationships.add(newRelationship(match.entity(), target, RelationshipType.IMPLEMENTS,
                        IMPLEMENTS_CONFIDENCE));
            }
        }
        entities.addAll(placeholders.values());
    }

    private void extractImports(String text, List<Entity> entities) {
        Matcher esMatcher = ES_IMPORT_PATTERN.matcher(text);
        while (esMatcher.find()) {
            entities.add(newModuleEntity(esMatcher.group(1), esMatcher));
        }

        Matcher qualifiedMatcher = QUALIFIED_IMPORT_PATTERN.matcher(text);
        while (qualifiedMatcher.find()) {
            entities.add(newModuleEntity(qualifiedMatcher.group(1), qualifiedMatcher));
        }
    }

    private Entity resolveParent(String name, Map<String, Entity> declared, Map<String, Entity> placeholders) {
        Entity existing = declared.get(name);
        if (existing != null) {
            return existing;
        }
        return placeholders.computeIfAbsent(name, missing -> Entity.builder()
                .id(newId("entity"))
                .text(missing)
                .type(EntityType.CLASS)
                .position(TextPosition.NONE)
                .attributes(new LinkedHashMap<>(Map.of(Entity.ATTR_SOURCE, Entity.SOURCE_INFERRED)))
                .build());
    }

    private void applyContext(List<Entity> entities, Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            return;
        }
        for (Entity entity : entities) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    entity.getAttributes().put(CONTEXT_PREFIX + entry.getKey(), entry.getValue());
                }
            }
        }
    }

    private void computeEmbeddings(List<Entity> entities) {
        for (Entity entity : entities) {
            embeddingService.embed(entity.getText()).ifPresent(entity::setEmbedding);
        }
    }

    private void linkSimilarEntities(List<Entity> entities, List<Relationship> relationships) {
        for (int i = 0; i < entities.size(); i++) {
            Entity first = entities.get(i);
            if (!first.hasEmbedding()) {
                continue;
            }
            for (int j = i + 1; j < entities.size(); j++) {
                Entity second = entities.get(j);
                if (first.getType() != second.getType() || !second.hasEmbedding()) {
                    continue;
                }
                double similarity = embeddingService.similarity(first.getEmbedding(), second.getEmbedding());
                if (similarity > similarityThreshold) {
                    Relationship relationship = newRelationship(first, second, RelationshipType.SIMILAR_TO,
                            Math.min(1.0, similarity));
                    relationship.setBidirectional(true);
                    relationship.setMetadata(Map.of("similarity", similarity));
                    relationships.add(relationship);
                }
            }
        }
    }

    static double calculateConfidence(List<Entity> entities, List<Relationship> relationships) {
        if (entities.isEmpty()) {
            return 0.0;
        }
        double averageRelationshipConfidence = relationships.isEmpty()
                ? 0.5
                : relationships.stream().mapToDouble(Relationship::getConfidence).average().orElse(0.5);
        return Math.min(MAX_CONFIDENCE, 0.5 + entities.size() * 0.05 + averageRelationshipConfidence * 0.3);
    }

    private Entity newEntity(String text, EntityType type, Matcher matcher, String source) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(Entity.ATTR_SOURCE, source);
        return Entity.builder()
                .id(newId("entity"))
                .text(text)
                .type(type)
                .position(new TextPosition(matcher.start(), matcher.end()))
                .attributes(attributes)
                .build();
    }

    private Entity newModuleEntity(String module, Matcher matcher) {
        Entity entity = newEntity(module, EntityType.CONCEPT, matcher, Entity.SOURCE_IMPORT);
        entity.getAttributes().put(ATTR_MODULE_TYPE, "module");
        return entity;
    }

    private Relationship newRelationship(Entity source, Entity target, RelationshipType type, double confidence) {
        return Relationship.builder()
                .id(newId("rel"))
                .sourceEntityId(source.getId())
                .targetEntityId(target.getId())
                .type(type)
                .confidence(confidence)
                .bidirectional(false)
                .build();
    }

    private static List<String> splitTypeList(String group) {
        if (group == null || group.isBlank()) {
            return List.of();
        }
        String withoutGenerics = stripGenerics(group);
        List<String> names = new ArrayList<>();
        for (String part : withoutGenerics.split(",")) {
            String name = part.trim();
            int lastDot = name.lastIndexOf('.');
            if (lastDot >= 0) {
                name = name.substring(lastDot + 1);
            }
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    private static String stripGenerics(String value) {
        StringBuilder result = new StringBuilder();
        int depth = 0;
        for (char c : value.toCharArray()) {
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0) {
                result.append(c);
            }
        }
        return result.toString();
    }

    private static String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID();
    }

    private record ClassMatch(Entity entity, List<String> parents, List<String> contracts) {
    }
}
