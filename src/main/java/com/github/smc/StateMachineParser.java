package com.github.smc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.smc.CompilerException.Code;

/**
 * Single pass recursive descent parser for {@code .sm} files. The grammar, in order of the methods
 * below:
 *
 * <pre>
 * file        := 'machine' IDENT section* EOF
 * section     := events | resetEvents | commands | state | transition
 * events      := 'events' (IDENT (IDENT | CODE))* 'end'
 * resetEvents := 'resetEvents' IDENT* 'end'
 * commands    := 'commands' (IDENT (IDENT | CODE))* 'end'
 * state       := ['initial'] 'state' IDENT stateItem* 'end'
 * stateItem   := 'entry' actions | 'exit' actions | 'on' tail
 * actions     := '{' IDENT* '}'
 * transition  := 'transition' IDENT 'on' tail
 * tail        := IDENT ['[' guard ']'] ['/' IDENT] '=>' IDENT
 * guard       := and ('||' and)*
 * and         := unary ('&&' unary)*
 * unary       := '!' unary | IDENT | 'true' | 'false' | '(' guard ')'
 * </pre>
 *
 * State names used by transitions are kept as written, forward references included; resolving them
 * is the checker's job. The first malformed construct aborts the parse with a
 * {@link SyntaxException} pointing at the offending token, no partial model is returned.
 */
public final class StateMachineParser {
  private static final Logger logger =
      LogManager.getLogger(StateMachineParser.class.getSimpleName());

  private final List<Token> tokens;
  private int cursor;

  private final List<EventDeclaration> events = new ArrayList<>();
  private final List<String> resetEvents = new ArrayList<>();
  private final List<SourceLocation> resetEventLocations = new ArrayList<>();
  private final List<CommandDeclaration> commands = new ArrayList<>();
  private final List<State> states = new ArrayList<>();
  private final List<Transition> transitions = new ArrayList<>();

  private StateMachineParser(final List<Token> tokens) {
    this.tokens = tokens;
  }

  /**
   * Parse one state machine from source text.
   */
  public static StateMachine parse(final String text) throws SyntaxException {
    final List<Token> tokens = new Lexer(text).tokenize();
    if (logger.isDebugEnabled()) {
      logger.debug("Tokenized input into " + tokens.size() + " tokens");
    }
    return new StateMachineParser(tokens).machine();
  }

  private StateMachine machine() throws SyntaxException {
    final SourceLocation start = expect(TokenType.MACHINE).getLocation();
    final String name = expect(TokenType.IDENT).getText();
    while (peek().getType() != TokenType.EOF) {
      section();
    }
    final StateMachine machine = new StateMachine(name, events, resetEvents, resetEventLocations,
        commands, states, transitions, start);
    if (logger.isDebugEnabled()) {
      logger.debug("Parsed " + machine);
    }
    return machine;
  }

  private void section() throws SyntaxException {
    final Token token = peek();
    switch (token.getType()) {
      case EVENTS:
        events();
        break;
      case RESET_EVENTS:
        resetEvents();
        break;
      case COMMANDS:
        commands();
        break;
      case INITIAL:
      case STATE:
        state();
        break;
      case TRANSITION:
        transition();
        break;
      default:
        throw unexpected(token, "a section ('events', 'resetEvents', 'commands', 'state', "
            + "'initial state' or 'transition')");
    }
  }

  private void events() throws SyntaxException {
    expect(TokenType.EVENTS);
    while (peek().getType() != TokenType.END) {
      final Token name = expect(TokenType.IDENT);
      events.add(new EventDeclaration(name.getText(), code().getText(), name.getLocation()));
    }
    expect(TokenType.END);
  }

  private void resetEvents() throws SyntaxException {
    expect(TokenType.RESET_EVENTS);
    while (peek().getType() != TokenType.END) {
      final Token name = expect(TokenType.IDENT);
      resetEvents.add(name.getText());
      resetEventLocations.add(name.getLocation());
    }
    expect(TokenType.END);
  }

  private void commands() throws SyntaxException {
    expect(TokenType.COMMANDS);
    while (peek().getType() != TokenType.END) {
      final Token name = expect(TokenType.IDENT);
      commands.add(new CommandDeclaration(name.getText(), code().getText(), name.getLocation()));
    }
    expect(TokenType.END);
  }

  private Token code() throws SyntaxException {
    final Token token = next();
    if (token.getType() != TokenType.IDENT && token.getType() != TokenType.CODE) {
      throw unexpected(token, "a code");
    }
    return token;
  }

  private void state() throws SyntaxException {
    final SourceLocation location = peek().getLocation();
    final boolean initial = accept(TokenType.INITIAL);
    expect(TokenType.STATE);
    final String name = expect(TokenType.IDENT).getText();
    List<String> entryActions = null;
    List<String> exitActions = null;
    while (peek().getType() != TokenType.END) {
      final Token item = next();
      switch (item.getType()) {
        case ENTRY:
          if (entryActions != null) {
            throw duplicateClause(item, name);
          }
          entryActions = actions();
          break;
        case EXIT:
          if (exitActions != null) {
            throw duplicateClause(item, name);
          }
          exitActions = actions();
          break;
        case ON:
          tail(name, item.getLocation());
          break;
        default:
          throw unexpected(item, "'entry', 'exit', 'on' or 'end'");
      }
    }
    expect(TokenType.END);
    states.add(new State(name, initial, entryActions == null ? List.of() : entryActions,
        exitActions == null ? List.of() : exitActions, location));
  }

  private List<String> actions() throws SyntaxException {
    expect(TokenType.LBRACE);
    final List<String> actions = new ArrayList<>();
    while (peek().getType() != TokenType.RBRACE) {
      actions.add(expect(TokenType.IDENT).getText());
    }
    expect(TokenType.RBRACE);
    return actions;
  }

  private void transition() throws SyntaxException {
    final SourceLocation location = expect(TokenType.TRANSITION).getLocation();
    final String source = expect(TokenType.IDENT).getText();
    expect(TokenType.ON);
    tail(source, location);
  }

  private void tail(final String source, final SourceLocation location) throws SyntaxException {
    final String event = expect(TokenType.IDENT).getText();
    Optional<Guard> guard = Optional.empty();
    if (accept(TokenType.LBRACKET)) {
      guard = Optional.of(guard());
      expect(TokenType.RBRACKET);
    }
    Optional<String> action = Optional.empty();
    if (accept(TokenType.SLASH)) {
      action = Optional.of(expect(TokenType.IDENT).getText());
    }
    expect(TokenType.ARROW);
    final String target = expect(TokenType.IDENT).getText();
    transitions.add(new Transition(source, event, guard, action, target, location));
  }

  private Guard guard() throws SyntaxException {
    Guard left = conjunction();
    while (accept(TokenType.OR)) {
      left = new Guard.Or(left, conjunction());
    }
    return left;
  }

  private Guard conjunction() throws SyntaxException {
    Guard left = unary();
    while (accept(TokenType.AND)) {
      left = new Guard.And(left, unary());
    }
    return left;
  }

  private Guard unary() throws SyntaxException {
    final Token token = next();
    switch (token.getType()) {
      case NOT:
        return new Guard.Not(unary());
      case IDENT:
        return new Guard.Reference(token.getText());
      case TRUE:
        return new Guard.Constant(true);
      case FALSE:
        return new Guard.Constant(false);
      case LPAREN: {
        final Guard inner = guard();
        expect(TokenType.RPAREN);
        return inner;
      }
      default:
        throw unexpected(token, "a guard condition");
    }
  }

  ///// token plumbing /////
  private Token peek() {
    return tokens.get(cursor);
  }

  private Token next() {
    final Token token = tokens.get(cursor);
    if (token.getType() != TokenType.EOF) {
      cursor++;
    }
    return token;
  }

  private boolean accept(final TokenType type) {
    if (peek().getType() == type) {
      next();
      return true;
    }
    return false;
  }

  private Token expect(final TokenType type) throws SyntaxException {
    final Token token = next();
    if (token.getType() != type) {
      throw unexpected(token,
          type == TokenType.IDENT ? "an identifier" : "'" + type.getSpelling() + "'");
    }
    return token;
  }

  private static SyntaxException unexpected(final Token token, final String expected) {
    if (token.getType() == TokenType.EOF) {
      return new SyntaxException(Code.UNEXPECTED_END_OF_INPUT, token.getLocation(), "",
          "expected " + expected + " but input ended");
    }
    String message = "expected " + expected + " but found " + token.describe();
    if (token.getType() != TokenType.IDENT && TokenType.isKeyword(token.getText())) {
      message += " (reserved keyword)";
    }
    return new SyntaxException(Code.UNEXPECTED_TOKEN, token.getLocation(), token.getText(),
        message);
  }

  private static SyntaxException duplicateClause(final Token clause, final String stateName) {
    return new SyntaxException(Code.DUPLICATE_CLAUSE, clause.getLocation(), clause.getText(),
        "'" + clause.getText() + "' given twice in state " + stateName);
  }
}
