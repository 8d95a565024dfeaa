package com.sandwichtrader.api.dto.response;

import com.sandwichtrader.domain.enums.LifecycleState;
import lombok.Builder;
import lombok.Data;

/** Result of a manual entry: whether the legs were placed and the state afterwards. */
@Data
@Builder
public class EntryResponse {

    private boolean entered;
    private LifecycleState state;
}
