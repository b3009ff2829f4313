package org.surveyworkbench.models.entity;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
public class ParticipantRecord {

    public static final String PARTICIPANT_ID = "participant_id";

    private String participantId;
    private Map<String, String> fields = new LinkedHashMap<>();

    public ParticipantRecord(String participantId) {
        this.participantId = participantId;
    }

    public void addField(String fieldName, String value) {
        fields.put(fieldName, value);
    }

    public String getField(String fieldName) {
        return fields.get(fieldName);
    }

    public Map<String, String> toRow() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(PARTICIPANT_ID, participantId);
        fields.forEach(row::putIfAbsent);
        return Collections.unmodifiableMap(row);
    }
}
