package my.statementfusion.app.extraction;

/**
 * ISO 6166 check digit: letters expand to two digits (A=10 .. Z=35) and the resulting digit
 * string must pass the Luhn check.
 */
public class IsinChecksumCheck implements IdentifierCheck {
	@Override
	public boolean accepts(String code) {
		if (code == null || code.length() != 12 || !Character.isDigit(code.charAt(11))) {
			return false;
		}
		StringBuilder digits = new StringBuilder();
		for (char ch : code.toCharArray()) {
			if (ch >= '0' && ch <= '9') {
				digits.append(ch);
			} else if (ch >= 'A' && ch <= 'Z') {
				digits.append(ch - 'A' + 10);
			} else {
				return false;
			}
		}
		int sum = 0;
		boolean doubleIt = false;
		for (int i = digits.length() - 1; i >= 0; i--) {
			int digit = digits.charAt(i) - '0';
			if (doubleIt) {
				digit *= 2;
				if (digit > 9) {
					digit -= 9;
				}
			}
			sum += digit;
			doubleIt = !doubleIt;
		}
		return sum % 10 == 0;
	}
}
