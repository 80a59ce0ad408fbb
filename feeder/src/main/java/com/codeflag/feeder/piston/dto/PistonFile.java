package com.codeflag.feeder.piston.dto;

/** A source file in an execute request. The engine names it itself. */
public record PistonFile(String content) {}
