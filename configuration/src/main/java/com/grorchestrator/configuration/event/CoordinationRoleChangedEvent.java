package com.grorchestrator.configuration.event;

import com.grorchestrator.configuration.model.CoordinationRole;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Event which is fired when this node gains or loses coordination authority.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CoordinationRoleChangedEvent {
    private CoordinationRole previousRole;
    private CoordinationRole newRole;
}
