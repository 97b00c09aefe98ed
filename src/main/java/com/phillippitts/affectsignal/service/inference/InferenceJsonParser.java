package com.phillippitts.affectsignal.service.inference;

import com.phillippitts.affectsignal.domain.EmotionScore;
import com.phillippitts.affectsignal.domain.EmotionVector;
import com.phillippitts.affectsignal.exception.SchemaException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Interprets the three JSON payloads of the batch inference protocol.
 *
 * <p>Predictions are nested several layers deep:
 * <pre>
 * [ { "results": { "predictions": [ { "models": { "face": {
 *       "grouped_predictions": [ { "predictions": [ { "emotions": [ {"name", "score"} ] } ] } ]
 * } } } ] } } ]
 * </pre>
 * A file entry that carries {@code models} directly, without the {@code results} wrapper, is
 * accepted too. A missing or mistyped layer raises {@link SchemaException} naming the layer. Explicitly empty
 * {@code grouped_predictions}, {@code predictions} or {@code emotions} arrays mean no face was
 * detected and yield an empty vector.
 */
final class InferenceJsonParser {

    private static final Logger LOG = LogManager.getLogger(InferenceJsonParser.class);

    /** Guard against pathological payloads; a single-frame response is a few kilobytes. */
    static final int MAX_JSON_SIZE = 2 * 1024 * 1024;

    private InferenceJsonParser() {
    }

    /**
     * Reads the job identifier from a create-job response ({@code job_id}, else {@code id}).
     *
     * @return job id, or null if the body carries none
     */
    static String parseJobId(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JSONObject obj = new JSONObject(body);
            String id = obj.optString("job_id", "");
            if (id.isBlank()) {
                id = obj.optString("id", "");
            }
            return id.isBlank() ? null : id;
        } catch (JSONException e) {
            LOG.warn("Create-job response is not a JSON object: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Reads the job state from {@code state.status} or a top-level {@code status}.
     * Anything other than COMPLETED or FAILED counts as still running.
     *
     * @throws SchemaException if the body is not a JSON object
     */
    static JobState parseStatus(String body) {
        JSONObject obj;
        try {
            obj = new JSONObject(body == null ? "" : body);
        } catch (JSONException e) {
            throw new SchemaException("status", "not a JSON object", e);
        }
        String status = null;
        JSONObject state = obj.optJSONObject("state");
        if (state != null) {
            status = state.optString("status", null);
        }
        if (status == null) {
            status = obj.optString("status", "");
        }
        return switch (status.trim().toUpperCase(Locale.ROOT)) {
            case "COMPLETED" -> JobState.COMPLETED;
            case "FAILED" -> JobState.FAILED;
            default -> JobState.RUNNING;
        };
    }

    /**
     * Unwraps the face emotions of the first file, first face group and first face.
     *
     * @return raw vector in upstream order; empty when no face was detected
     * @throws SchemaException if any layer is missing or has the wrong type
     */
    static EmotionVector parseEmotions(String body) {
        if (body == null || body.isBlank()) {
            throw new SchemaException("root", "empty body");
        }
        if (body.length() > MAX_JSON_SIZE) {
            throw new SchemaException("root", "payload exceeds " + MAX_JSON_SIZE + " chars");
        }
        JSONArray files;
        try {
            files = new JSONArray(body);
        } catch (JSONException e) {
            throw new SchemaException("root", "not a JSON array", e);
        }
        JSONObject file = requireFirst(files, "root");
        JSONObject sourcePrediction;
        JSONObject results = file.optJSONObject("results");
        if (results != null) {
            JSONArray sourcePredictions = results.optJSONArray("predictions");
            if (sourcePredictions == null) {
                throw new SchemaException("results.predictions", "missing");
            }
            sourcePrediction = requireFirst(sourcePredictions, "results.predictions");
        } else if (file.has("models")) {
            sourcePrediction = file;
        } else {
            throw new SchemaException("results", "missing");
        }
        JSONObject models = sourcePrediction.optJSONObject("models");
        if (models == null) {
            throw new SchemaException("models", "missing");
        }
        JSONObject face = models.optJSONObject("face");
        if (face == null) {
            throw new SchemaException("models.face", "missing");
        }
        JSONArray groups = face.optJSONArray("grouped_predictions");
        if (groups == null) {
            throw new SchemaException("grouped_predictions", "missing");
        }
        if (groups.isEmpty()) {
            return EmotionVector.empty();
        }
        JSONObject group = groups.optJSONObject(0);
        if (group == null) {
            throw new SchemaException("grouped_predictions", "first entry is not an object");
        }
        JSONArray faces = group.optJSONArray("predictions");
        if (faces == null) {
            throw new SchemaException("grouped_predictions.predictions", "missing");
        }
        if (faces.isEmpty()) {
            return EmotionVector.empty();
        }
        JSONObject firstFace = faces.optJSONObject(0);
        if (firstFace == null) {
            throw new SchemaException("grouped_predictions.predictions", "first entry is not an object");
        }
        JSONArray emotions = firstFace.optJSONArray("emotions");
        if (emotions == null) {
            throw new SchemaException("emotions", "missing");
        }
        return toVector(emotions);
    }

    private static JSONObject requireFirst(JSONArray array, String layer) {
        if (array.isEmpty()) {
            throw new SchemaException(layer, "empty array");
        }
        JSONObject first = array.optJSONObject(0);
        if (first == null) {
            throw new SchemaException(layer, "first entry is not an object");
        }
        return first;
    }

    private static EmotionVector toVector(JSONArray emotions) {
        List<EmotionScore> scores = new ArrayList<>(emotions.length());
        for (int i = 0; i < emotions.length(); i++) {
            JSONObject e = emotions.optJSONObject(i);
            if (e == null) {
                continue;
            }
            String name = e.optString("name", "");
            double score = e.optDouble("score", Double.NaN);
            if (name.isBlank() || Double.isNaN(score)) {
                LOG.debug("Skipping malformed emotion entry at index {}", i);
                continue;
            }
            scores.add(new EmotionScore(name, score));
        }
        return new EmotionVector(scores);
    }
}
