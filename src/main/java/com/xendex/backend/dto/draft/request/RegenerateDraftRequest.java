package com.xendex.backend.dto.draft.request;

import com.xendex.backend.enums.StrategyAngle;
import lombok.Data;

@Data
public class RegenerateDraftRequest {
    private StrategyAngle angle;
}
