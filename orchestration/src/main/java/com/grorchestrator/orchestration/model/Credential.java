package com.grorchestrator.orchestration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Credential {
    private String name;
    @ToString.Exclude
    private String value;
    private long version;
    private CredentialScope scope;
    /**
     * Only for relation scoped credentials.
     */
    private Integer relationId;
    private String database;
    /**
     * Version which was applied to the engine account. Lower than version if engine update is pending.
     */
    private long appliedVersion;
    /**
     * Value which is still active in the engine while rotation is not applied.
     */
    @ToString.Exclude
    private String previousValue;

    public boolean isAppliedToEngine() {
        return appliedVersion >= version;
    }

    /**
     * @return value which the engine currently accepts
     */
    public String getEngineValue() {
        return isAppliedToEngine() || previousValue == null ? value : previousValue;
    }
}
