package com.example.poolguard.core;

import java.text.MessageFormat;
import java.util.List;
import java.util.ResourceBundle;
import java.util.concurrent.CopyOnWriteArrayList;

/** System.Logger that keeps every record for assertions. */
final class RecordingLogger implements System.Logger {

  record Entry(Level level, String message, Throwable thrown) {}

  private final List<Entry> entries = new CopyOnWriteArrayList<>();

  List<Entry> entries() {
    return entries;
  }

  List<Entry> at(final Level level) {
    return entries.stream().filter(e -> e.level() == level).toList();
  }

  @Override
  public String getName() {
    return "recording";
  }

  @Override
  public boolean isLoggable(final Level level) {
    return true;
  }

  @Override
  public void log(
      final Level level, final ResourceBundle bundle, final String msg, final Throwable thrown) {
    entries.add(new Entry(level, msg, thrown));
  }

  @Override
  public void log(
      final Level level, final ResourceBundle bundle, final String format, final Object... params) {
    final var msg =
        params == null || params.length == 0 ? format : MessageFormat.format(format, params);
    entries.add(new Entry(level, msg, null));
  }
}
