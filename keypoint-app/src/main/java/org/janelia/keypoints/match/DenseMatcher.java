package org.janelia.keypoints.match;

/**
 * A dense matching model that produces raw correspondences for an image pair.
 */
public interface DenseMatcher {

    /**
     * @return correspondences oriented from the pair's image A to its image B.
     *
     * @throws Exception
     *   if the model fails for this pair (the failure is recorded and the pair is skipped).
     */
    PairCorrespondences match(ImagePair pair)
            throws Exception;

}
