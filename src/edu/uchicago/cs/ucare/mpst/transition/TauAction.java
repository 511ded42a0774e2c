package edu.uchicago.cs.ucare.mpst.transition;

@SuppressWarnings("serial")
public class TauAction extends LocalAction {

  public TauAction() {
    super(Type.TAU);
  }

  @Override
  public String getObservableKey() {
    return "tau";
  }

  @Override
  public String getKey() {
    return "tau";
  }

}
