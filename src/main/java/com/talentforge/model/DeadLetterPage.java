package com.talentforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterPage {

    private List<DeadLetterView> deadLetters;
    private long total;
    private int page;
    private int totalPages;
    private int limit;
}
