package cn.pianzi.holdem.core.config;

/**
 * How the turn timer behaves when a paused game resumes.
 */
public enum ResumePolicy {
    RESTART_FULL,
    PRESERVE_REMAINING
}
