package com.shipyard.core.stage;

import com.shipyard.core.model.Stage;
import com.shipyard.core.model.StageKind;
import com.shipyard.core.model.StageResult;

/**
 * Performs the side effect for one {@link StageKind}.
 * <p>
 * Implementations report assertion failures as results and signal infrastructure
 * problems by throwing {@link com.shipyard.core.collaborator.CollaboratorException};
 * {@link StageRunner} turns the latter into a failed result.
 */
public interface StageHandler {

    StageKind kind();

    StageResult handle(Stage stage, StageContext context);
}
