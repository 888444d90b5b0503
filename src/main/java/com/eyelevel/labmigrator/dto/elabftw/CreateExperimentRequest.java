package com.eyelevel.labmigrator.dto.elabftw;

import java.util.List;

/**
 * Body of {@code POST experiments}.
 */
public record CreateExperimentRequest(String title, List<String> tags) {
}
