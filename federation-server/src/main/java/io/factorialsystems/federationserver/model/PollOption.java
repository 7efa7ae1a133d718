package io.factorialsystems.federationserver.model;

import lombok.*;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PollOption {
    private String text;
    private int votes;

    public static PollOption of(String text) {
        return new PollOption(text, 0);
    }
}
