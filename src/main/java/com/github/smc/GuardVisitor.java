package com.github.smc;

public interface GuardVisitor<R> {

  R visitReference(Guard.Reference reference);

  R visitConstant(Guard.Constant constant);

  R visitNot(Guard.Not not);

  R visitAnd(Guard.And and);

  R visitOr(Guard.Or or);
}
