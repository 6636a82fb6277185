package eu.virtualparadox.hybridrag.curated.service;

import eu.virtualparadox.hybridrag.curated.model.CuratedRecord;

import java.util.List;

/**
 * Durable set of reviewer-approved question/answer pairs.
 */
public interface CuratedRecordStore {

    /**
     * @return the approved set, one record per distinct question
     */
    List<CuratedRecord> listApproved();

    /**
     * Records a newly approved pair.
     *
     * @return the stored record
     */
    CuratedRecord save(final String question, final String answer);
}
