package dev.rune.scheduler.cli;

import dev.rune.scheduler.credentials.CredentialEncryption;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
    name = "keygen",
    description = "Print a new credential encryption key for the ENCRYPTION_KEY env var",
    mixinStandardHelpOptions = true)
public class KeygenCommand implements Callable<Integer> {

  @Spec CommandSpec spec;

  @Override
  public Integer call() {
    spec.commandLine().getOut().println(CredentialEncryption.generateKey());
    return 0;
  }
}
