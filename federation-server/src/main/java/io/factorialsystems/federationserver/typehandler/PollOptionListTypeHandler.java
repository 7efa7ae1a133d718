package io.factorialsystems.federationserver.typehandler;

import com.fasterxml.jackson.core.type.TypeReference;
import io.factorialsystems.federationserver.model.PollOption;

import java.util.ArrayList;
import java.util.List;

public class PollOptionListTypeHandler extends JsonTypeHandler<List<PollOption>> {

    public PollOptionListTypeHandler() {
        super(new TypeReference<List<PollOption>>() {});
    }

    @Override
    protected List<PollOption> emptyValue() {
        return new ArrayList<>();
    }
}
