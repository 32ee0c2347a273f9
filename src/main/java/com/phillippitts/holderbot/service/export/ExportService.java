package com.phillippitts.holderbot.service.export;

import com.phillippitts.holderbot.domain.SourceKind;
import com.phillippitts.holderbot.domain.SubjectRecord;
import com.phillippitts.holderbot.service.store.PatternLearningStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot export of all subject records (JSON array or CSV) and bulk import of
 * pre-existing classifications.
 */
@Service
public class ExportService {
    private static final Logger LOG = LogManager.getLogger(ExportService.class);

    static final String CSV_HEADER =
            "subject_id,material,type,confidence,source_kind,timestamp,verified,correction_count";

    private final PatternLearningStore store;

    public ExportService(PatternLearningStore store) {
        this.store = Objects.requireNonNull(store);
    }

    public String exportJson() {
        JSONArray out = new JSONArray();
        for (SubjectRecord r : store.findAll()) {
            out.put(new JSONObject()
                    .put("subjectId", r.subjectId())
                    .put("material", r.material())
                    .put("type", r.type())
                    .put("confidence", r.confidence())
                    .put("sourceKind", r.sourceKind().name())
                    .put("timestamp", r.timestamp().toString())
                    .put("verified", r.verified())
                    .put("correctionCount", r.correctionCount()));
        }
        return out.toString(2);
    }

    public String exportCsv() {
        StringBuilder sb = new StringBuilder(CSV_HEADER).append('\n');
        for (SubjectRecord r : store.findAll()) {
            sb.append(csv(r.subjectId())).append(',')
                    .append(csv(r.material())).append(',')
                    .append(csv(r.type())).append(',')
                    .append(r.confidence()).append(',')
                    .append(r.sourceKind().name()).append(',')
                    .append(r.timestamp()).append(',')
                    .append(r.verified()).append(',')
                    .append(r.correctionCount()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Imports a JSON array of {@code {subjectId, material, type, confidence}} objects as verified
     * records. A missing confidence means 1.0.
     *
     * @return number of records written
     * @throws IllegalArgumentException if the document or any row is malformed; nothing is written
     */
    public int importJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("import document is empty");
        }
        List<SubjectRecord> rows = new ArrayList<>();
        try {
            JSONArray array = new JSONArray(json);
            Instant now = Instant.now();
            for (int i = 0; i < array.length(); i++) {
                JSONObject o = array.getJSONObject(i);
                double confidence = o.has("confidence") ? o.getDouble("confidence") : 1.0;
                if (Double.isNaN(confidence)) {
                    throw new IllegalArgumentException("row " + i + " has a non-numeric confidence");
                }
                rows.add(new SubjectRecord(
                        requireText(o, "subjectId", i),
                        requireText(o, "material", i),
                        requireText(o, "type", i),
                        confidence,
                        SourceKind.IMPORTED, now, true, 0));
            }
        } catch (JSONException e) {
            throw new IllegalArgumentException("import document is not a JSON array of objects: " + e.getMessage(), e);
        }
        int written = store.importRecords(rows);
        LOG.info("Bulk import wrote {} of {} rows", written, rows.size());
        return written;
    }

    private static String requireText(JSONObject o, String key, int index) {
        String v = o.optString(key, "").strip();
        if (v.isEmpty()) {
            throw new IllegalArgumentException("row " + index + " has no " + key);
        }
        return v;
    }

    static String csv(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
