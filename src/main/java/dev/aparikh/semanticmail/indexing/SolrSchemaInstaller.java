package dev.aparikh.semanticmail.indexing;

import dev.aparikh.semanticmail.model.IndexedEmail;
import dev.aparikh.semanticmail.model.SyncCursor;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.request.schema.FieldTypeDefinition;
import org.apache.solr.client.solrj.request.schema.SchemaRequest;
import org.apache.solr.client.solrj.response.schema.FieldTypeRepresentation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Adds the field types and fields the stores rely on to existing cores through the Schema
 * API. Fields that already exist are left untouched, so running it twice is harmless.
 */
public class SolrSchemaInstaller {

    private static final Logger log = LoggerFactory.getLogger(SolrSchemaInstaller.class);

    static final String VECTOR_TYPE = "knn_vector_cosine";

    private final SolrClient solr;
    private final int dimension;

    public SolrSchemaInstaller(SolrClient solr, int dimension) {
        this.solr = solr;
        this.dimension = dimension;
    }

    public void install(String emailsCore, String cursorsCore) {
        try {
            installEmails(emailsCore);
            installCursors(cursorsCore);
        } catch (SolrServerException | IOException e) {
            throw new StoreException(StoreException.Reason.UNAVAILABLE, "Failed to install Solr schema", e);
        }
    }

    private void installEmails(String core) throws SolrServerException, IOException {
        Set<String> types = new SchemaRequest.FieldTypes().process(solr, core).getFieldTypes().stream()
                .map(FieldTypeRepresentation::getAttributes)
                .map(a -> String.valueOf(a.get("name")))
                .collect(Collectors.toSet());
        if (!types.contains(VECTOR_TYPE)) {
            FieldTypeDefinition def = new FieldTypeDefinition();
            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put("name", VECTOR_TYPE);
            attrs.put("class", "solr.DenseVectorField");
            attrs.put("vectorDimension", dimension);
            attrs.put("similarityFunction", "cosine");
            def.setAttributes(attrs);
            new SchemaRequest.AddFieldType(def).process(solr, core);
            log.info("Added field type {} ({} dimensions) to {}", VECTOR_TYPE, dimension, core);
        }

        Set<String> existing = existingFields(core);
        addField(core, existing, IndexedEmail.FIELD_USER_ID, "string", false);
        addField(core, existing, IndexedEmail.FIELD_EXTERNAL_ID, "string", false);
        addField(core, existing, IndexedEmail.FIELD_THREAD_ID, "string", false);
        addField(core, existing, IndexedEmail.FIELD_SENDER, "string", false);
        addField(core, existing, IndexedEmail.FIELD_RECIPIENTS, "string", true);
        addField(core, existing, IndexedEmail.FIELD_SUBJECT, "text_general", false);
        addField(core, existing, IndexedEmail.FIELD_CONTENT, "text_general", false);
        addField(core, existing, IndexedEmail.FIELD_SENT_AT, "pdate", false);
        addField(core, existing, IndexedEmail.FIELD_FOLDER_LABELS, "string", true);
        addField(core, existing, IndexedEmail.FIELD_IS_FILTERED, "boolean", false);
        addField(core, existing, IndexedEmail.FIELD_FILTER_REASON, "string", false);
        addStoredOnly(core, existing, IndexedEmail.FIELD_TEXT_CHUNKS);
        addStoredOnly(core, existing, EmailIndexService.FIELD_VECTOR_METADATA);
        addField(core, existing, IndexedEmail.FIELD_EMBEDDING, VECTOR_TYPE, false);
        addField(core, existing, IndexedEmail.FIELD_VECTORIZED_AT, "pdate", false);
        addField(core, existing, IndexedEmail.FIELD_CREATED_AT, "pdate", false);
    }

    private void installCursors(String core) throws SolrServerException, IOException {
        Set<String> existing = existingFields(core);
        addField(core, existing, SyncCursor.FIELD_LAST_SYNCED_AT, "pdate", false);
        addField(core, existing, SyncCursor.FIELD_LAST_RUN_STATUS, "string", false);
        addField(core, existing, SyncCursor.FIELD_UPDATED_AT, "pdate", false);
    }

    private Set<String> existingFields(String core) throws SolrServerException, IOException {
        return new SchemaRequest.Fields().process(solr, core).getFields().stream()
                .map(f -> String.valueOf(f.get("name")))
                .collect(Collectors.toCollection(HashSet::new));
    }

    private void addField(String core, Set<String> existing, String name, String type, boolean multiValued)
            throws SolrServerException, IOException {
        Map<String, Object> field = new HashMap<>();
        field.put("type", type);
        field.put("stored", true);
        field.put("indexed", true);
        field.put("multiValued", multiValued);
        add(core, existing, name, field);
    }

    // Chunk JSON can exceed the 32k term limit of indexed or docValues string fields
    private void addStoredOnly(String core, Set<String> existing, String name)
            throws SolrServerException, IOException {
        Map<String, Object> field = new HashMap<>();
        field.put("type", "string");
        field.put("stored", true);
        field.put("indexed", false);
        field.put("docValues", false);
        add(core, existing, name, field);
    }

    private void add(String core, Set<String> existing, String name, Map<String, Object> field)
            throws SolrServerException, IOException {
        if (existing.contains(name)) return;
        field.put("name", name);
        new SchemaRequest.AddField(field).process(solr, core);
        existing.add(name);
        log.debug("Added field {} to {}", name, core);
    }
}
