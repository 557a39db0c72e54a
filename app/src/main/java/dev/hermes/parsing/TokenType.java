package dev.hermes.parsing;

public enum TokenType {
  // definitions
  SCHEME,     // def
  ABANDON,    // return
  FORTIFY,    // class
  MYSELF,     // self
  INITIALIZE, // __init__

  // conditionals
  AAHAAN,   // if
  CASCADE,  // elif
  THATS_IT, // else

  // loops
  ITERATE,  // for
  WITHIN,   // in
  REPEAT,   // while
  COLLAPSE, // break
  SKIP,     // continue

  // error handling
  ATTEMPT,  // try
  GRIEVE,   // except
  VALIDATE, // finally
  ESCALATE, // raise

  // values
  TRUTH,
  FALSEHOOD,
  NOTHING,

  // comparison & logic keywords
  SAME_AS,
  DIFFERS_FROM,
  GREATER_THAN,
  LESSER_THAN,
  AT_LEAST,
  AT_MOST,
  KINSHIP,   // and
  ALTERNATE, // or
  NEGATE,    // not

  // builtin i/o
  ANNOUNCE, // print
  LISTEN,   // input

  // modules
  CONGREGATION, // import
  FROM,
  AS,

  // advanced
  DESIRE,    // lambda
  PRODUCE,   // yield
  RECOGNIZE, // global
  CONTEXT,   // with

  // operators
  PLUS,
  MINUS,
  STAR,
  SLASH,
  DOUBLE_SLASH,
  PERCENT,
  DOUBLE_STAR,

  ASSIGN,
  PLUS_ASSIGN,
  MINUS_ASSIGN,
  STAR_ASSIGN,
  SLASH_ASSIGN,

  EQ,
  NE,
  LT,
  GT,
  LE,
  GE,

  // delimiters
  LPAREN,
  RPAREN,
  LBRACKET,
  RBRACKET,
  LBRACE,
  RBRACE,
  COMMA,
  COLON,
  DOT,
  ARROW,
  AT,

  // literals
  INTEGER,
  FLOAT,
  STRING,
  FSTRING,

  IDENTIFIER,

  // structure
  NEWLINE,
  INDENT,
  DEDENT,
  COMMENT,
  EOF
}
