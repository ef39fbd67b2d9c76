package kwe.util.keyword;

/** Whether the target document counts as a member of the corpus when computing document frequencies. */
public enum TargetInclusion {
    /** the target is one more corpus document: it adds to the document total and to the document frequency of every phrase it contains */
    INCLUDE_TARGET,

    /** only the corpus documents supplied by the caller are counted */
    EXCLUDE_TARGET
}
