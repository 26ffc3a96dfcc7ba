package com.tx.insights.taxonomy;

/**
 * Structural problems found while assembling a taxonomy. None of them abort a run.
 */
public enum AnomalyType {
    DANGLING_PARENT,   // parentId not present in the node set, node treated as root
    DUPLICATE_PATH,    // two spellings normalize to the same node
    PATH_CONFLICT,     // id collision with a different parent chain, subtree skipped
    DEPTH_MISMATCH,    // declared depth disagrees with the parent chain
    CYCLE              // parent chain loops back, broken at this node
}
