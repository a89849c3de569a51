package de.ialistannen.stevedore.timing;

@FunctionalInterface
public interface ExceptionalRunnable {

  void run() throws Exception;
}
