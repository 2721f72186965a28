/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
 */
package dev.mars.notevault.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Converts between raw document bytes and {@link NoteDocument}.
 * <p>
 * <b>Format:</b>
 * <pre>
 * {
 *   "0":     {"title": "...", "content": "..."},
 *   "3":     {"title": "...", "content": "..."},
 *   "_meta": {"id_count": 4, "old_ids": [1, 2]}
 * }
 * </pre>
 * <p>
 * <b>Corruption policy:</b> bytes that are not valid JSON, or whose top-level value
 * is not an object, or that carry anything after the top-level value, decode to an
 * empty document. Nothing is thrown; a corrupted store reads as "no notes". Individual entries that do not fit the format (non-numeric
 * or non-canonical keys such as {@code "05"}, missing title/content) are dropped,
 * and an unreadable {@code _meta} is treated as absent so that the next metadata
 * bootstrap rewrites it.
 */
public final class DocumentCodec {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentCodec.class);

    static final String FIELD_TITLE = "title";
    static final String FIELD_CONTENT = "content";
    static final String FIELD_ID_COUNT = "id_count";
    static final String FIELD_OLD_IDS = "old_ids";

    private final ObjectMapper objectMapper;
    private final ObjectReader treeReader;

    public DocumentCodec() {
        this(new ObjectMapper());
    }

    public DocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.treeReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    // ========================================================================
    // Decode
    // ========================================================================

    /**
     * Decodes a document. Never throws.
     *
     * @param bytes raw document content, may be null or empty
     * @return the decoded document, empty if {@code bytes} is missing or corrupt
     */
    public NoteDocument decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0 || new String(bytes, StandardCharsets.UTF_8).isBlank()) {
            LOG.trace("Decoding empty content as empty document");
            return NoteDocument.empty();
        }

        JsonNode root;
        try {
            root = treeReader.readTree(bytes);
        } catch (IOException e) {
            LOG.warn("Document is not valid JSON, resetting to empty document: {}", e.getMessage());
            return NoteDocument.empty();
        }

        if (root == null || !root.isObject()) {
            LOG.warn("Document top-level value is {}, not an object; resetting to empty document",
                    root == null ? "missing" : root.getNodeType());
            return NoteDocument.empty();
        }

        NoteDocument document = NoteDocument.empty();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();

            if (NoteDocument.META_KEY.equals(key)) {
                decodeMeta(value).ifPresent(document::setMeta);
                continue;
            }

            OptionalLong id = IdParser.parse(key);
            if (id.isEmpty()) {
                LOG.warn("Dropping document entry with non-numeric key '{}'", key);
                continue;
            }
            if (!Long.toString(id.getAsLong()).equals(key)) {
                LOG.warn("Dropping document entry with non-canonical key '{}'", key);
                continue;
            }
            decodeNote(id.getAsLong(), value).ifPresentOrElse(
                    document::put,
                    () -> LOG.warn("Dropping malformed note entry '{}'", key));
        }

        LOG.debug("Decoded {}", document);
        return document;
    }

    private Optional<Note> decodeNote(long id, JsonNode value) {
        if (value == null || !value.isObject()) {
            return Optional.empty();
        }
        JsonNode title = value.get(FIELD_TITLE);
        JsonNode content = value.get(FIELD_CONTENT);
        if (title == null || !title.isTextual() || content == null || !content.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(new Note(id, title.textValue(), content.textValue()));
    }

    private Optional<DocumentMeta> decodeMeta(JsonNode value) {
        if (value == null || !value.isObject()) {
            LOG.warn("Ignoring {} entry that is not an object", NoteDocument.META_KEY);
            return Optional.empty();
        }

        long idCount = 0L;
        JsonNode idCountNode = value.get(FIELD_ID_COUNT);
        if (idCountNode != null) {
            if (!idCountNode.isIntegralNumber() || !idCountNode.canConvertToLong() || idCountNode.longValue() < 0) {
                LOG.warn("Ignoring {} with invalid {}: {}", NoteDocument.META_KEY, FIELD_ID_COUNT, idCountNode);
                return Optional.empty();
            }
            idCount = idCountNode.longValue();
        }

        List<Long> oldIds = new ArrayList<>();
        JsonNode oldIdsNode = value.get(FIELD_OLD_IDS);
        if (oldIdsNode != null) {
            if (!oldIdsNode.isArray()) {
                LOG.warn("Ignoring {} with non-array {}", NoteDocument.META_KEY, FIELD_OLD_IDS);
                return Optional.empty();
            }
            for (JsonNode element : oldIdsNode) {
                if (!element.isIntegralNumber() || !element.canConvertToLong() || element.longValue() < 0) {
                    LOG.warn("Ignoring {} with invalid recycled id: {}", NoteDocument.META_KEY, element);
                    return Optional.empty();
                }
                oldIds.add(element.longValue());
            }
        }

        return Optional.of(new DocumentMeta(idCount, oldIds));
    }

    // ========================================================================
    // Encode
    // ========================================================================

    /**
     * Encodes a document as UTF-8 JSON.
     *
     * @param document the document to encode
     * @param layout   compact or indented output
     * @return the encoded bytes
     */
    public byte[] encode(NoteDocument document, DocumentLayout layout) {
        ObjectNode root = toTree(document);
        try {
            return layout == DocumentLayout.INDENTED
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root)
                    : objectMapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode document", e);
        }
    }

    /**
     * Builds the JSON tree for a document; {@code _meta} is written last.
     */
    ObjectNode toTree(NoteDocument document) {
        ObjectNode root = objectMapper.createObjectNode();
        for (Note note : document.notes().values()) {
            ObjectNode entry = root.putObject(Long.toString(note.id()));
            entry.put(FIELD_TITLE, note.title());
            entry.put(FIELD_CONTENT, note.content());
        }
        document.meta().ifPresent(meta -> {
            ObjectNode metaNode = root.putObject(NoteDocument.META_KEY);
            metaNode.put(FIELD_ID_COUNT, meta.idCount());
            ArrayNode oldIds = metaNode.putArray(FIELD_OLD_IDS);
            for (long oldId : meta.oldIds()) {
                oldIds.add(oldId);
            }
        });
        return root;
    }
}
