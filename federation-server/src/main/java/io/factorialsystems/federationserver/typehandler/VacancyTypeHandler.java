package io.factorialsystems.federationserver.typehandler;

import com.fasterxml.jackson.core.type.TypeReference;
import io.factorialsystems.federationserver.model.Vacancy;

public class VacancyTypeHandler extends JsonTypeHandler<Vacancy> {

    public VacancyTypeHandler() {
        super(new TypeReference<Vacancy>() {});
    }

    @Override
    protected Vacancy emptyValue() {
        return Vacancy.none();
    }
}
