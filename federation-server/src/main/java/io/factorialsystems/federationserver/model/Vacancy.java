package io.factorialsystems.federationserver.model;

import lombok.*;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Vacancy {
    private boolean available;
    private String description;

    /**
     * A description only travels with an open vacancy.
     */
    public Vacancy normalized() {
        return new Vacancy(available, available ? description : null);
    }

    public static Vacancy none() {
        return new Vacancy(false, null);
    }
}
