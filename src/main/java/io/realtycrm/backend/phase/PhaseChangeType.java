package io.realtycrm.backend.phase;

public enum PhaseChangeType {
  ENROLL,
  EXIT,
  ADVANCE,
  DEMOTE,
  ENTER_SOLITARY,
  EXIT_SOLITARY,
  PRESTIGE,
  ULTRA
}
