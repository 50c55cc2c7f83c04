package seedrec.services;

public enum Tone { SERIOUS, LIGHT, ACTION, MYSTERY, NEUTRAL }
