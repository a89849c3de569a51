package de.ialistannen.stevedore.target;

/**
 * Whether a target currently has a pull job running.
 */
public enum PullState {
  IDLE,
  PULLING
}
