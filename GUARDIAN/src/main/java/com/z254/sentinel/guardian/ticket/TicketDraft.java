package com.z254.sentinel.guardian.ticket;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A ticket about to be written.
 */
@Value
@Builder
public class TicketDraft {

    TicketName name;

    @Singular("frontMatterEntry")
    Map<String, String> frontMatter;

    @Singular
    List<String> lines;
}
