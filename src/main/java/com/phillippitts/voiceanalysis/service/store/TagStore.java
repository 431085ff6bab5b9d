package com.phillippitts.voiceanalysis.service.store;

import com.phillippitts.voiceanalysis.domain.Tag;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Many-to-many association between analyses and user tags.
 */
public interface TagStore {

    /** Tag names of one analysis, alphabetical. */
    Set<String> findByAnalysisId(long analysisId);

    /**
     * Replaces the analysis's tag set, creating tags that do not yet exist.
     *
     * @return the stored names after trimming and de-duplication
     */
    Set<String> replaceTags(long analysisId, Collection<String> names);

    List<Tag> findAll();

    /** @return number of associations removed */
    int deleteForAnalysis(long analysisId);
}
